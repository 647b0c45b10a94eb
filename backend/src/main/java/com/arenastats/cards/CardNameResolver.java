package com.arenastats.cards;

import com.arenastats.parser.model.ObjectFacts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Names the grp ids of a match, from the card database where possible and locally otherwise.
 */
@Component
public class CardNameResolver {

    private static final Logger log = LoggerFactory.getLogger(CardNameResolver.class);

    private static final String FACE_SEPARATOR = " // ";
    private static final String COLOR_PREFIX = "CardColor_";
    private static final String SUBTYPE_PREFIX = "SubType_";
    private static final String CARD_TYPE_PREFIX = "CardType_";

    private final CardDatabaseClient cardDatabase;

    public CardNameResolver(CardDatabaseClient cardDatabase) {
        this.cardDatabase = cardDatabase;
    }

    /**
     * Resolves real cards in one batch. Misses get an {@code Unknown Card (id)} placeholder.
     *
     * @param grpIds Real card ids
     * @return One entry per id, in ascending id order
     */
    public List<ResolvedCard> resolveRealCards(Set<Integer> grpIds) {
        if (grpIds.isEmpty()) {
            return List.of();
        }
        Map<Integer, Optional<CardFacts>> lookups = cardDatabase.lookupMany(grpIds);
        List<ResolvedCard> resolved = new ArrayList<>(grpIds.size());
        for (Integer grpId : new TreeSet<>(grpIds)) {
            Optional<CardFacts> facts = lookups.getOrDefault(grpId, Optional.empty())
                    .filter(CardNameResolver::hasName);
            if (facts.isPresent()) {
                resolved.add(new ResolvedCard(grpId, facts.get().name(), facts.get(), false, null, null, true));
            } else {
                log.debug("Card grpId={} not found in card database", grpId);
                resolved.add(new ResolvedCard(grpId, unknownCardName(grpId), null, false, null, null, false));
            }
        }
        return resolved;
    }

    /**
     * Resolves special objects. Tokens and emblems are named from their own facts, other faces
     * are looked up first and fall back to a bracketed placeholder.
     *
     * @param specialObjects Special object facts keyed by grp id
     * @return One entry per id, in map order
     */
    public List<ResolvedCard> resolveSpecialObjects(Map<Integer, ObjectFacts> specialObjects) {
        List<ResolvedCard> resolved = new ArrayList<>(specialObjects.size());
        specialObjects.forEach((grpId, facts) -> resolved.add(resolveSpecialObject(grpId, facts)));
        return resolved;
    }

    ResolvedCard resolveSpecialObject(int grpId, ObjectFacts facts) {
        String objectType = facts.objectType();
        if (GameObjectTypes.isGenerated(objectType)) {
            String name = tokenName(facts);
            log.debug("Naming token grpId={} as '{}'", grpId, name);
            return new ResolvedCard(grpId, name, null, true, objectType, null, true);
        }

        Optional<CardFacts> direct = cardDatabase.lookup(grpId).filter(CardNameResolver::hasName);
        if (direct.isPresent()) {
            return new ResolvedCard(grpId, direct.get().name(), direct.get(), false, objectType, null, true);
        }

        if (GameObjectTypes.OMEN.equals(objectType)) {
            int frontFaceId = grpId - 1;
            Optional<String> backFace = cardDatabase.lookup(frontFaceId)
                    .map(CardFacts::name)
                    .filter(name -> name.contains(FACE_SEPARATOR))
                    .map(name -> name.split(FACE_SEPARATOR, -1)[1]);
            if (backFace.isPresent()) {
                return new ResolvedCard(grpId, backFace.get(), null, false, objectType, frontFaceId, true);
            }
        }

        String placeholder = "[" + GameObjectTypes.label(objectType) + "] (" + grpId + ")";
        log.debug("Naming special object grpId={} as '{}'", grpId, placeholder);
        return new ResolvedCard(grpId, placeholder, null, false, objectType, null, false);
    }

    public static String unknownCardName(int grpId) {
        return "Unknown Card (" + grpId + ")";
    }

    /**
     * Builds a token name such as {@code 1/1 Red Goblin Creature Token}, or {@code Emblem}.
     */
    public static String tokenName(ObjectFacts facts) {
        if (GameObjectTypes.EMBLEM.equals(facts.objectType())) {
            return "Emblem";
        }
        List<String> parts = new ArrayList<>();
        if (facts.power() != null && facts.toughness() != null) {
            parts.add(facts.power() + "/" + facts.toughness());
        }
        for (String color : facts.colors()) {
            parts.add(stripPrefix(color, COLOR_PREFIX));
        }
        for (String subtype : facts.subtypes()) {
            parts.add(subtype.replace(SUBTYPE_PREFIX, ""));
        }
        for (String cardType : facts.cardTypes()) {
            parts.add(cardType.replace(CARD_TYPE_PREFIX, ""));
        }
        parts.add("Token");
        return String.join(" ", parts);
    }

    // Index entries without a name count as misses.
    private static boolean hasName(CardFacts facts) {
        return facts.name() != null && !facts.name().isBlank();
    }

    private static String stripPrefix(String value, String prefix) {
        return value.startsWith(prefix) ? value.substring(prefix.length()) : value;
    }
}
