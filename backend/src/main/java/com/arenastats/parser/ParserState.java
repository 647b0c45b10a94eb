package com.arenastats.parser;

import com.arenastats.parser.model.MatchAggregate;

import java.util.ArrayList;
import java.util.List;

/**
 * Reducer state: the open match (if any), the matches already closed, and the sticky turn number
 * of the open match. The record itself is immutable but the open {@link MatchAccumulator} is not:
 * {@link MatchStateReducer#apply} mutates it in place, so a state must not be reused once it has
 * been reduced.
 */
public record ParserState(
        MatchAccumulator openMatch,
        List<MatchAggregate> completed,
        int lastTurnNumber
) {

    public ParserState {
        completed = List.copyOf(completed);
    }

    public static ParserState initial() {
        return new ParserState(null, List.of(), 0);
    }

    String openMatchId() {
        return openMatch == null ? null : openMatch.matchId;
    }

    /**
     * Closes the open match, if any, and makes {@code next} the open one.
     */
    ParserState openNewMatch(MatchAccumulator next) {
        return new ParserState(next, closeOpenMatch(), 0);
    }

    ParserState withLastTurnNumber(int turnNumber) {
        return new ParserState(openMatch, completed, turnNumber);
    }

    /**
     * All matches in the order they were first seen, the still-open one last.
     */
    public List<MatchAggregate> finish() {
        return closeOpenMatch();
    }

    private List<MatchAggregate> closeOpenMatch() {
        if (openMatch == null) {
            return completed;
        }
        List<MatchAggregate> closed = new ArrayList<>(completed);
        closed.add(openMatch.toAggregate());
        return closed;
    }
}
