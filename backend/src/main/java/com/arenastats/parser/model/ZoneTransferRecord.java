package com.arenastats.parser.model;

/**
 * One object moving between two match-local zones. {@code grpId} is null when the object was
 * never identified (face-down or engine-internal).
 */
public record ZoneTransferRecord(
        Integer gameStateId,
        Integer turnNumber,
        Integer instanceId,
        Integer grpId,
        Integer fromZone,
        Integer toZone,
        String category
) {

    public static final String CATEGORY_TOKEN_CREATED = "TokenCreated";

    public boolean hasCardReference() {
        return grpId != null;
    }

    public boolean isTokenCreation() {
        return CATEGORY_TOKEN_CREATED.equals(category);
    }
}
