package com.arenastats.parser.model;

/**
 * Outcome from the local player's point of view. Draws are never detected; an unfinished or
 * undecided match has no result at all.
 */
public enum MatchResult {
    WIN("win"),
    LOSS("loss");

    private final String value;

    MatchResult(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
