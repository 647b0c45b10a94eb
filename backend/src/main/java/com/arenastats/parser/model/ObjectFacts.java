package com.arenastats.parser.model;

import java.util.List;

/**
 * Latest snapshot of one game object as reported by the rules engine.
 */
public record ObjectFacts(
        Integer grpId,
        String objectType,
        List<String> cardTypes,
        List<String> subtypes,
        List<String> colors,
        Integer power,
        Integer toughness,
        Integer ownerSeatId,
        Integer controllerSeatId
) {
    public ObjectFacts {
        cardTypes = cardTypes == null ? List.of() : List.copyOf(cardTypes);
        subtypes = subtypes == null ? List.of() : List.copyOf(subtypes);
        colors = colors == null ? List.of() : List.copyOf(colors);
    }
}
