package com.arenastats.cards;

import com.arenastats.parser.model.ObjectFacts;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of classifying one match's card references.
 *
 * @param realCardIds Ids to resolve against the card database
 * @param specialObjects Tokens, emblems and alternate faces, with the facts used to name them
 */
public record CardClassification(Set<Integer> realCardIds, Map<Integer, ObjectFacts> specialObjects) {

    public CardClassification {
        realCardIds = Collections.unmodifiableSet(new LinkedHashSet<>(realCardIds));
        specialObjects = Collections.unmodifiableMap(new LinkedHashMap<>(specialObjects));
    }

    public Set<Integer> allIds() {
        Set<Integer> all = new LinkedHashSet<>(realCardIds);
        all.addAll(specialObjects.keySet());
        return all;
    }

    public boolean isEmpty() {
        return realCardIds.isEmpty() && specialObjects.isEmpty();
    }
}
