package com.arenastats.cards;

/**
 * A grp id with the name it will be stored under.
 *
 * @param grpId Arena id
 * @param name Display name, a placeholder when the database had no entry
 * @param facts Card database entry, null when none was used
 * @param token Whether the name was generated for a token or emblem
 * @param objectType Game object type for special objects, null for real cards
 * @param sourceGrpId Front face id an Omen name was taken from
 * @param found Whether the id resolved to a card database entry or a generated name
 */
public record ResolvedCard(
        int grpId,
        String name,
        CardFacts facts,
        boolean token,
        String objectType,
        Integer sourceGrpId,
        boolean found
) {
}
