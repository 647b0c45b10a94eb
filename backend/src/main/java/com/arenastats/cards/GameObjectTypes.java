package com.arenastats.cards;

import java.util.Set;

/**
 * Object type markers the game engine attaches to game objects.
 */
public final class GameObjectTypes {

    public static final String CARD = "GameObjectType_Card";
    public static final String TOKEN = "GameObjectType_Token";
    public static final String EMBLEM = "GameObjectType_Emblem";
    public static final String OMEN = "GameObjectType_Omen";
    public static final String ABILITY = "GameObjectType_Ability";
    public static final String TRIGGER_HOLDER = "GameObjectType_TriggerHolder";
    public static final String REVEALED_CARD = "GameObjectType_RevealedCard";

    private static final String PREFIX = "GameObjectType_";

    /**
     * Engine-only objects. These never name a card and are never stored.
     */
    public static final Set<String> INTERNAL = Set.of(ABILITY, TRIGGER_HOLDER, REVEALED_CARD);

    /**
     * Objects created by card abilities that have no printed card of their own.
     */
    public static final Set<String> GENERATED = Set.of(TOKEN, EMBLEM);

    private GameObjectTypes() {
    }

    public static boolean isInternal(String objectType) {
        return objectType != null && INTERNAL.contains(objectType);
    }

    public static boolean isGenerated(String objectType) {
        return objectType != null && GENERATED.contains(objectType);
    }

    /**
     * Short label for an object type, e.g. {@code Adventure} for {@code GameObjectType_Adventure}.
     */
    public static String label(String objectType) {
        if (objectType == null || objectType.isEmpty()) {
            return "Unknown";
        }
        return objectType.startsWith(PREFIX) ? objectType.substring(PREFIX.length()) : objectType;
    }
}
