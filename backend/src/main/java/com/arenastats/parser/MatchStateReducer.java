package com.arenastats.parser;

import com.arenastats.parser.model.ActionRecord;
import com.arenastats.parser.model.LifeSnapshot;
import com.arenastats.parser.model.MatchResult;
import com.arenastats.parser.model.ObjectFacts;
import com.arenastats.parser.model.ZoneTransferRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Folds decoded log events into match aggregates, one open match at a time.
 */
public class MatchStateReducer {

    private static final Logger log = LoggerFactory.getLogger(MatchStateReducer.class);

    /**
     * Seat number the client assigns to the local player in its own log.
     */
    public static final int LOCAL_PLAYER_SEAT = 2;

    /**
     * Applies one event to the state. This is not a pure function: the open match of {@code state}
     * is updated in place, and the returned state may share it. Callers must drop {@code state}
     * after the call and keep only the result.
     *
     * @param state Current state, mutated and consumed by this call
     * @param event Decoded event
     * @param raw Raw event the decoded one came from (timestamps, line number)
     * @return The next state
     */
    public ParserState apply(ParserState state, GameEvent event, RawEvent raw) {
        if (event instanceof GameEvent.MatchStateChanged matchState) {
            return onMatchState(state, matchState, raw);
        }
        if (event instanceof GameEvent.GreMessageBatch batch) {
            return onGameStates(state, batch, raw);
        }
        if (event instanceof GameEvent.DeckSubmitted deck) {
            return onDeck(state, deck);
        }
        return state;
    }

    private ParserState onMatchState(ParserState state, GameEvent.MatchStateChanged event, RawEvent raw) {
        String matchId = event.matchId();
        if (matchId == null || matchId.isEmpty()) {
            return state;
        }

        ParserState next = state;
        if (!matchId.equals(state.openMatchId())) {
            OffsetDateTime startTime = eventTime(raw);
            next = state.openNewMatch(new MatchAccumulator(matchId, startTime));
            log.debug("Opened match {} at line {}", matchId, raw.lineNumber());
        }
        MatchAccumulator match = next.openMatch();

        for (GameEvent.ReservedPlayer player : event.reservedPlayers()) {
            Integer seat = player.systemSeatId();
            if (seat != null && seat == LOCAL_PLAYER_SEAT) {
                match.playerName = player.playerName();
                match.playerSeatId = seat;
                match.playerUserId = player.userId();
            } else {
                match.opponentName = player.playerName();
                match.opponentSeatId = seat;
                match.opponentUserId = player.userId();
            }
            if (player.eventId() != null && !player.eventId().isEmpty() && match.eventId == null) {
                match.eventId = player.eventId();
            }
        }

        if (event.isMatchCompleted()) {
            OffsetDateTime endTime = eventTime(raw);
            if (endTime != null) {
                match.endTime = endTime;
            }
            GameEvent.FinalMatchResult finalResult = event.finalMatchResult();
            if (finalResult != null) {
                match.winningTeamId = finalResult.winningTeamId();
                for (GameEvent.ResultEntry entry : finalResult.resultList()) {
                    if (!entry.isMatchScope()) {
                        continue;
                    }
                    Integer winner = entry.winningTeamId();
                    if (winner != null && winner.equals(match.playerSeatId)) {
                        match.result = MatchResult.WIN;
                    } else if (winner != null && winner != 0) {
                        match.result = MatchResult.LOSS;
                    }
                    match.winningReason = entry.reason();
                }
            }
            log.debug("Match {} completed with result {}", matchId, match.result);
        }
        return next;
    }

    private ParserState onGameStates(ParserState state, GameEvent.GreMessageBatch batch, RawEvent raw) {
        MatchAccumulator match = state.openMatch();
        if (match == null) {
            return state;
        }

        int lastTurnNumber = state.lastTurnNumber();
        for (GameEvent.GameStateMessage message : batch.gameStateMessages()) {
            int gameStateId = message.gameStateId();
            GameEvent.TurnInfo turnInfo = message.turnInfo();

            int turnNumber = turnInfo.turnNumber();
            if (turnNumber > 0) {
                lastTurnNumber = turnNumber;
            } else if (lastTurnNumber > 0) {
                turnNumber = lastTurnNumber;
            }
            match.totalTurns = Math.max(match.totalTurns, turnNumber);

            if (message.gameInfo() != null) {
                match.format = message.gameInfo().superFormat();
                match.matchType = message.gameInfo().type();
            }

            for (GameEvent.PlayerLife player : message.players()) {
                match.addLifeSnapshot(new LifeSnapshot(
                        gameStateId, turnNumber, player.seatNumber(), player.lifeTotal()));
            }

            for (GameEvent.GameObject object : message.gameObjects()) {
                match.putObject(object.instanceId(), object.facts());
            }

            for (GameEvent.LegalAction action : message.actions()) {
                Integer cardGrpId = knownGrpId(match.object(action.instanceId()));
                if (cardGrpId == null) {
                    cardGrpId = nonZero(action.grpId());
                }
                match.addAction(new ActionRecord(
                        gameStateId,
                        turnNumber,
                        turnInfo.phase(),
                        turnInfo.step(),
                        turnInfo.activePlayer(),
                        action.seatId(),
                        action.actionType(),
                        action.instanceId(),
                        cardGrpId,
                        action.abilityGrpId(),
                        action.manaCost(),
                        raw.timestampMs()));
            }

            for (GameEvent.ZoneTransferAnnotation annotation : message.zoneTransfers()) {
                for (Integer instanceId : annotation.affectedIds()) {
                    match.addZoneTransfer(new ZoneTransferRecord(
                            gameStateId,
                            turnNumber,
                            instanceId,
                            knownGrpId(match.object(instanceId)),
                            annotation.zoneSrc(),
                            annotation.zoneDest(),
                            annotation.category()));
                }
            }
        }
        return state.withLastTurnNumber(lastTurnNumber);
    }

    private ParserState onDeck(ParserState state, GameEvent.DeckSubmitted deck) {
        MatchAccumulator match = state.openMatch();
        if (match == null) {
            return state;
        }
        if (deck.deckId() != null || deck.deckName() != null) {
            match.deckId = deck.deckId();
            match.deckName = deck.deckName();
        }
        if (deck.format() != null) {
            match.format = deck.format();
        }
        if (deck.mainDeck() != null) {
            match.deckCards = deck.mainDeck();
        }
        return state;
    }

    private static OffsetDateTime eventTime(RawEvent raw) {
        if (raw.timestampMs() != null) {
            return Instant.ofEpochMilli(raw.timestampMs()).atOffset(ZoneOffset.UTC);
        }
        return raw.loggerTimestamp();
    }

    private static Integer knownGrpId(ObjectFacts facts) {
        return facts == null ? null : nonZero(facts.grpId());
    }

    private static Integer nonZero(Integer value) {
        return value == null || value == 0 ? null : value;
    }
}
