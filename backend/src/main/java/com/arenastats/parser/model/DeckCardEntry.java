package com.arenastats.parser.model;

public record DeckCardEntry(int cardId, int quantity) {
}
