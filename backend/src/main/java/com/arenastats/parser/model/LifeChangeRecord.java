package com.arenastats.parser.model;

/**
 * A recorded life total. {@code changeAmount} is null for the first sighting of a seat and never zero.
 */
public record LifeChangeRecord(
        Integer gameStateId,
        Integer turnNumber,
        int seatId,
        int lifeTotal,
        Integer changeAmount
) {
}
