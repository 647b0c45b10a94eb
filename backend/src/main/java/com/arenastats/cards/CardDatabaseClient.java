package com.arenastats.cards;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only access to card definitions by Arena id (grpId).
 * Population of the underlying data is handled outside this application.
 */
public interface CardDatabaseClient {

    /**
     * Looks up one card definition.
     *
     * @param arenaId The Arena card id
     * @return The card, or empty when the database does not know the id
     */
    Optional<CardFacts> lookup(int arenaId);

    /**
     * Looks up several card definitions at once.
     *
     * @param arenaIds Arena ids to resolve
     * @return One entry per requested id, empty for misses
     */
    Map<Integer, Optional<CardFacts>> lookupMany(Set<Integer> arenaIds);
}
