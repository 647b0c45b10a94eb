package com.arenastats.parser;

import com.arenastats.parser.model.DeckCardEntry;
import com.arenastats.parser.model.ObjectFacts;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Decoded shape of a classified log payload. Anything that does not match one of the handled
 * shapes is {@link Unclassified} and carries no data.
 */
public sealed interface GameEvent {

    record MatchStateChanged(
            String matchId,
            String stateType,
            List<ReservedPlayer> reservedPlayers,
            FinalMatchResult finalMatchResult
    ) implements GameEvent {

        public static final String STATE_MATCH_COMPLETED = "MatchGameRoomStateType_MatchCompleted";

        public boolean isMatchCompleted() {
            return STATE_MATCH_COMPLETED.equals(stateType);
        }
    }

    record ReservedPlayer(
            String playerName,
            String userId,
            Integer systemSeatId,
            String eventId
    ) {
    }

    record FinalMatchResult(Integer winningTeamId, List<ResultEntry> resultList) {
    }

    record ResultEntry(String scope, Integer winningTeamId, String reason) {

        public static final String SCOPE_MATCH = "MatchScope_Match";

        public boolean isMatchScope() {
            return SCOPE_MATCH.equals(scope);
        }
    }

    record GreMessageBatch(List<GameStateMessage> gameStateMessages) implements GameEvent {
    }

    record GameStateMessage(
            int gameStateId,
            TurnInfo turnInfo,
            GameInfo gameInfo,
            List<PlayerLife> players,
            List<GameObject> gameObjects,
            List<LegalAction> actions,
            List<ZoneTransferAnnotation> zoneTransfers
    ) {
    }

    record TurnInfo(int turnNumber, String phase, String step, Integer activePlayer) {

        static final TurnInfo EMPTY = new TurnInfo(0, "", "", null);
    }

    record GameInfo(String superFormat, String type) {
    }

    record PlayerLife(int seatNumber, int lifeTotal) {
    }

    record GameObject(int instanceId, ObjectFacts facts) {
    }

    record LegalAction(
            Integer seatId,
            String actionType,
            Integer instanceId,
            Integer grpId,
            Integer abilityGrpId,
            JsonNode manaCost
    ) {
    }

    record ZoneTransferAnnotation(
            List<Integer> affectedIds,
            Integer zoneSrc,
            Integer zoneDest,
            String category
    ) {
    }

    /**
     * Deck submitted for the current event. Fields missing from the payload are null.
     */
    record DeckSubmitted(
            String deckId,
            String deckName,
            String format,
            List<DeckCardEntry> mainDeck
    ) implements GameEvent {
    }

    record Unclassified() implements GameEvent {

        static final Unclassified INSTANCE = new Unclassified();
    }
}
