package com.arenastats.parser;

import com.arenastats.parser.model.ActionRecord;
import com.arenastats.parser.model.DeckCardEntry;
import com.arenastats.parser.model.MatchAggregate;
import com.arenastats.parser.model.MatchResult;
import com.arenastats.parser.model.ObjectFacts;
import com.arenastats.parser.model.ZoneTransferRecord;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class MatchStateReducerTest {

    private final MatchStateReducer reducer = new MatchStateReducer();

    @Test
    void apply_assignsLocalAndOpponentSeats() {
        ParserState state = reducer.apply(ParserState.initial(), playing("m-1",
                new GameEvent.ReservedPlayer("Bob", "u-bob", 1, ""),
                new GameEvent.ReservedPlayer("Alice", "u-alice", 2, "Ladder")), raw(1_000L));

        MatchAggregate match = single(state);
        assertEquals("Alice", match.playerName());
        assertEquals(2, match.playerSeatId());
        assertEquals("u-alice", match.playerUserId());
        assertEquals("Bob", match.opponentName());
        assertEquals(1, match.opponentSeatId());
        assertEquals("Ladder", match.eventId());
        assertEquals(OffsetDateTime.of(1970, 1, 1, 0, 0, 1, 0, ZoneOffset.UTC), match.startTime());
    }

    @Test
    void apply_keepsFirstEventId() {
        ParserState state = reducer.apply(ParserState.initial(), playing("m-1",
                new GameEvent.ReservedPlayer("Alice", "u-alice", 2, "Ladder")), raw(1_000L));
        state = reducer.apply(state, playing("m-1",
                new GameEvent.ReservedPlayer("Alice", "u-alice", 2, "Traditional_Ladder")), raw(2_000L));

        assertEquals("Ladder", single(state).eventId());
    }

    @Test
    void apply_newMatchIdClosesOpenMatch() {
        ParserState state = reducer.apply(ParserState.initial(), playing("m-1"), raw(1_000L));
        state = reducer.apply(state, turn(3), raw(null));
        state = reducer.apply(state, playing("m-2"), raw(5_000L));

        List<MatchAggregate> matches = state.finish();
        assertEquals(List.of("m-1", "m-2"), matches.stream().map(MatchAggregate::matchId).toList());
        assertNull(matches.get(0).endTime());
        assertEquals(0, state.lastTurnNumber());
    }

    @Test
    void apply_updatesOpenMatchInPlace() {
        ParserState before = open();

        ParserState after = reducer.apply(before, turn(4), raw(null));

        assertSame(before.openMatch(), after.openMatch());
        assertEquals(4, single(before).totalTurns());
    }

    @Test
    void apply_completionScoresWinAndLossBySeat() {
        ParserState won = reducer.apply(open(), completed("m-1", 2), raw(61_000L));
        ParserState lost = reducer.apply(open(), completed("m-1", 1), raw(61_000L));
        ParserState undecided = reducer.apply(open(), completed("m-1", 0), raw(61_000L));

        MatchAggregate win = single(won);
        assertEquals(MatchResult.WIN, win.result());
        assertEquals("ResultReason_Concede", win.winningReason());
        assertEquals(60, win.durationSeconds());
        assertEquals(MatchResult.LOSS, single(lost).result());
        assertNull(single(undecided).result());
    }

    @Test
    void apply_endTimeFallsBackToLoggerTimestamp() {
        OffsetDateTime logged = OffsetDateTime.of(2024, 1, 15, 15, 45, 12, 0, ZoneOffset.UTC);

        ParserState state = reducer.apply(open(), completed("m-1", 2),
                new RawEvent(LogEventKind.MATCH_STATE, null, null, 9, logged));

        assertEquals(logged, single(state).endTime());
    }

    @Test
    void apply_carriesTurnNumberIntoMessagesWithoutTurnInfo() {
        ParserState state = reducer.apply(open(), turn(3), raw(null));
        state = reducer.apply(state, new GameEvent.GreMessageBatch(List.of(message(5, GameEvent.TurnInfo.EMPTY,
                List.of(), List.of(castOf(40, 75000)), List.of()))), raw(null));
        state = reducer.apply(state, turn(2), raw(null));

        MatchAggregate match = single(state);
        assertEquals(3, match.totalTurns());
        assertEquals(3, match.actions().get(0).turnNumber());
        assertEquals(2, state.lastTurnNumber());
    }

    @Test
    void apply_dropsDuplicateActions() {
        GameEvent.GreMessageBatch batch = new GameEvent.GreMessageBatch(List.of(
                message(5, turnInfo(1), List.of(), List.of(castOf(40, 75000)), List.of())));

        ParserState state = reducer.apply(open(), batch, raw(10L));
        state = reducer.apply(state, batch, raw(20L));

        List<ActionRecord> actions = single(state).actions();
        assertEquals(1, actions.size());
        assertEquals(10L, actions.get(0).timestampMs());
    }

    @Test
    void apply_resolvesGrpIdsFromKnownObjects() {
        GameEvent.GameObject known = new GameEvent.GameObject(40, facts(75000));
        GameEvent.GameObject unnamed = new GameEvent.GameObject(41, facts(0));
        GameEvent.GreMessageBatch batch = new GameEvent.GreMessageBatch(List.of(message(6, turnInfo(2),
                List.of(known, unnamed),
                List.of(castOf(40, 1), castOf(99, 75002)),
                List.of(new GameEvent.ZoneTransferAnnotation(List.of(40, 41, 42), 31, 27, "CastSpell")))));

        MatchAggregate match = single(reducer.apply(open(), batch, raw(null)));

        assertEquals(75000, match.actions().get(0).cardGrpId());
        assertEquals(75002, match.actions().get(1).cardGrpId());
        assertEquals(List.of(
                new ZoneTransferRecord(6, 2, 40, 75000, 31, 27, "CastSpell"),
                new ZoneTransferRecord(6, 2, 41, null, 31, 27, "CastSpell"),
                new ZoneTransferRecord(6, 2, 42, null, 31, 27, "CastSpell")), match.zoneTransfers());
    }

    @Test
    void apply_ignoresGameStatesOutsideMatch() {
        ParserState initial = ParserState.initial();

        assertSame(initial, reducer.apply(initial, turn(1), raw(null)));
        assertSame(initial, reducer.apply(initial,
                new GameEvent.DeckSubmitted("deck-1", "Deck", null, List.of()), raw(null)));
    }

    @Test
    void apply_deckEventUpdatesOpenMatch() {
        ParserState state = reducer.apply(open(), new GameEvent.DeckSubmitted("deck-1", "Mono Green", "Standard",
                List.of(new DeckCardEntry(75000, 4))), raw(null));
        state = reducer.apply(state, new GameEvent.DeckSubmitted(null, null, null, null), raw(null));

        MatchAggregate match = single(state);
        assertEquals("deck-1", match.deckId());
        assertEquals("Mono Green", match.deckName());
        assertEquals("Standard", match.format());
        assertEquals(List.of(new DeckCardEntry(75000, 4)), match.deckCards());
    }

    private ParserState open() {
        return reducer.apply(ParserState.initial(), playing("m-1",
                new GameEvent.ReservedPlayer("Alice", "u-alice", 2, "Ladder"),
                new GameEvent.ReservedPlayer("Bob", "u-bob", 1, "Ladder")), raw(1_000L));
    }

    private static MatchAggregate single(ParserState state) {
        List<MatchAggregate> matches = state.finish();
        assertEquals(1, matches.size());
        return matches.get(0);
    }

    private static GameEvent.MatchStateChanged playing(String matchId, GameEvent.ReservedPlayer... players) {
        return new GameEvent.MatchStateChanged(matchId, "MatchGameRoomStateType_Playing", List.of(players), null);
    }

    private static GameEvent.MatchStateChanged completed(String matchId, int winner) {
        return new GameEvent.MatchStateChanged(matchId, GameEvent.MatchStateChanged.STATE_MATCH_COMPLETED, List.of(),
                new GameEvent.FinalMatchResult(winner, List.of(
                        new GameEvent.ResultEntry("MatchScope_Game", winner, "ResultReason_Game"),
                        new GameEvent.ResultEntry(GameEvent.ResultEntry.SCOPE_MATCH, winner, "ResultReason_Concede"))));
    }

    private static GameEvent.GreMessageBatch turn(int turnNumber) {
        return new GameEvent.GreMessageBatch(List.of(
                message(turnNumber, turnInfo(turnNumber), List.of(), List.of(), List.of())));
    }

    private static GameEvent.TurnInfo turnInfo(int turnNumber) {
        return new GameEvent.TurnInfo(turnNumber, "Phase_Main1", "", 2);
    }

    private static GameEvent.GameStateMessage message(int gameStateId, GameEvent.TurnInfo turnInfo,
                                                      List<GameEvent.GameObject> objects,
                                                      List<GameEvent.LegalAction> actions,
                                                      List<GameEvent.ZoneTransferAnnotation> transfers) {
        return new GameEvent.GameStateMessage(gameStateId, turnInfo, null, List.of(), objects, actions, transfers);
    }

    private static GameEvent.LegalAction castOf(int instanceId, int grpId) {
        return new GameEvent.LegalAction(2, "ActionType_Cast", instanceId, grpId, null, null);
    }

    private static ObjectFacts facts(int grpId) {
        return new ObjectFacts(grpId, "GameObjectType_Card", List.of(), List.of(), List.of(), null, null, 2, 2);
    }

    private static RawEvent raw(Long timestampMs) {
        return new RawEvent(LogEventKind.GRE_EVENT, null, timestampMs, 1, null);
    }
}
