package com.arenastats.parser.model;

/**
 * Life total of one seat as seen in one game state message, before diffing.
 */
public record LifeSnapshot(int gameStateId, int turnNumber, int seatId, int lifeTotal) {
}
