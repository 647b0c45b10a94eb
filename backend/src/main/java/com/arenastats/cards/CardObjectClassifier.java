package com.arenastats.cards;

import com.arenastats.parser.model.ActionRecord;
import com.arenastats.parser.model.DeckCardEntry;
import com.arenastats.parser.model.MatchAggregate;
import com.arenastats.parser.model.ObjectFacts;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits the grp ids a match references into real cards and special objects.
 *
 * <p>An Omen back face shares its grp id with the front face card, so any id ever seen as an
 * Omen is special no matter what else was seen for it. Otherwise an id seen as a plain card, or
 * listed in the deck, is real. Remaining object types are special and keep their first sighting.
 * Ids only referenced by actions are real.
 */
@Component
public class CardObjectClassifier {

    public CardClassification classify(MatchAggregate match) {
        return classify(match.deckCards(), match.objects().values(), match.actions());
    }

    public CardClassification classify(
            List<DeckCardEntry> deckCards,
            Collection<ObjectFacts> objects,
            List<ActionRecord> actions) {
        Map<Integer, ObjectFacts> omens = new LinkedHashMap<>();
        Set<Integer> sightedAsCard = new LinkedHashSet<>();
        Map<Integer, ObjectFacts> otherSightings = new LinkedHashMap<>();

        for (ObjectFacts facts : objects) {
            Integer grpId = facts.grpId();
            if (grpId == null || grpId == 0 || GameObjectTypes.isInternal(facts.objectType())) {
                continue;
            }
            String objectType = facts.objectType();
            if (GameObjectTypes.OMEN.equals(objectType)) {
                omens.putIfAbsent(grpId, facts);
            } else if (GameObjectTypes.CARD.equals(objectType)) {
                sightedAsCard.add(grpId);
            } else {
                otherSightings.putIfAbsent(grpId, facts);
            }
        }

        Set<Integer> realCardIds = new LinkedHashSet<>();
        for (DeckCardEntry entry : deckCards) {
            if (entry.cardId() != 0) {
                realCardIds.add(entry.cardId());
            }
        }
        realCardIds.addAll(sightedAsCard);
        realCardIds.removeAll(omens.keySet());

        Map<Integer, ObjectFacts> specialObjects = new LinkedHashMap<>(omens);
        otherSightings.forEach((grpId, facts) -> {
            if (!realCardIds.contains(grpId)) {
                specialObjects.putIfAbsent(grpId, facts);
            }
        });

        for (ActionRecord action : actions) {
            Integer grpId = action.cardGrpId();
            if (grpId != null && grpId != 0 && !specialObjects.containsKey(grpId)) {
                realCardIds.add(grpId);
            }
        }

        return new CardClassification(realCardIds, specialObjects);
    }
}
