package com.arenastats.cards;

import com.arenastats.parser.model.ActionRecord;
import com.arenastats.parser.model.DeckCardEntry;
import com.arenastats.parser.model.ObjectFacts;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CardObjectClassifierTest {

    private final CardObjectClassifier classifier = new CardObjectClassifier();

    @Test
    void classify_omenSightingWinsRegardlessOfOrder() {
        ObjectFacts asCard = facts(90001, GameObjectTypes.CARD);
        ObjectFacts asOmen = facts(90001, GameObjectTypes.OMEN);

        CardClassification cardFirst = classifier.classify(List.of(), List.of(asCard, asOmen), List.of());
        CardClassification omenFirst = classifier.classify(List.of(), List.of(asOmen, asCard), List.of());

        for (CardClassification classification : List.of(cardFirst, omenFirst)) {
            assertTrue(classification.realCardIds().isEmpty());
            assertEquals(GameObjectTypes.OMEN, classification.specialObjects().get(90001).objectType());
        }
    }

    @Test
    void classify_deckCardsAndCardSightingsAreReal() {
        CardClassification classification = classifier.classify(
                List.of(new DeckCardEntry(75000, 4), new DeckCardEntry(0, 1)),
                List.of(facts(75001, GameObjectTypes.CARD), facts(75000, "GameObjectType_Adventure")),
                List.of());

        assertEquals(Set.of(75000, 75001), classification.realCardIds());
        assertTrue(classification.specialObjects().isEmpty());
    }

    @Test
    void classify_keepsFirstSightingOfSpecialObject() {
        ObjectFacts token = facts(94000, GameObjectTypes.TOKEN);
        ObjectFacts adventure = facts(94000, "GameObjectType_Adventure");

        CardClassification classification = classifier.classify(List.of(), List.of(token, adventure), List.of());

        assertEquals(token, classification.specialObjects().get(94000));
    }

    @Test
    void classify_skipsInternalAndUnidentifiedObjects() {
        CardClassification classification = classifier.classify(List.of(), List.of(
                facts(70000, GameObjectTypes.ABILITY),
                facts(70001, GameObjectTypes.TRIGGER_HOLDER),
                facts(70002, GameObjectTypes.REVEALED_CARD),
                facts(0, GameObjectTypes.CARD),
                facts(null, GameObjectTypes.TOKEN)), List.of());

        assertTrue(classification.isEmpty());
    }

    @Test
    void classify_actionOnlyIdsAreRealUnlessSpecial() {
        CardClassification classification = classifier.classify(
                List.of(),
                List.of(facts(94000, GameObjectTypes.TOKEN)),
                List.of(action(80000), action(94000), action(null), action(0)));

        assertEquals(Set.of(80000), classification.realCardIds());
        assertEquals(Set.of(80000, 94000), classification.allIds());
    }

    private static ObjectFacts facts(Integer grpId, String objectType) {
        return new ObjectFacts(grpId, objectType, List.of(), List.of(), List.of(), null, null, 2, 2);
    }

    private static ActionRecord action(Integer grpId) {
        return new ActionRecord(1, 1, "Phase_Main1", "", 2, 2, "ActionType_Cast", 10, grpId, null, null, null);
    }
}
