package com.arenastats.parser.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A legal action offered to a seat at one game state. Actions are options, not moves taken.
 */
public record ActionRecord(
        int gameStateId,
        int turnNumber,
        String phase,
        String step,
        Integer activePlayerSeat,
        Integer seatId,
        String actionType,
        Integer instanceId,
        Integer cardGrpId,
        Integer abilityGrpId,
        JsonNode manaCost,
        Long timestampMs
) {

    public DedupKey dedupKey() {
        return new DedupKey(gameStateId, actionType, instanceId);
    }

    public record DedupKey(int gameStateId, String actionType, Integer instanceId) {
    }
}
