package com.arenastats.replay;

/**
 * Semantic role inferred for a match-local zone id.
 */
public enum ZoneRole {
    BATTLEFIELD("Battlefield", Kind.BATTLEFIELD),
    STACK("Stack", Kind.STACK),
    LIBRARY("Library", Kind.LIBRARY),
    OPPONENT_LIBRARY("Opponent Library", Kind.LIBRARY),
    HAND("Hand", Kind.HAND),
    OPPONENT_HAND("Opponent Hand", Kind.HAND),
    GRAVEYARD("Graveyard", Kind.GRAVEYARD),
    EXILE("Exile", Kind.EXILE);

    public static final String UNKNOWN_LABEL = "Unknown zone";

    /**
     * Role without the owner, as used by the replay verb table.
     */
    public enum Kind {
        BATTLEFIELD, STACK, LIBRARY, HAND, GRAVEYARD, EXILE
    }

    private final String label;
    private final Kind kind;

    ZoneRole(String label, Kind kind) {
        this.label = label;
        this.kind = kind;
    }

    public String getLabel() {
        return label;
    }

    public Kind getKind() {
        return kind;
    }
}
