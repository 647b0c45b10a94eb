package com.arenastats.parser.model;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

/**
 * Everything reconstructed about one match from the log.
 */
public record MatchAggregate(
        String matchId,
        String playerName,
        Integer playerSeatId,
        String playerUserId,
        String opponentName,
        Integer opponentSeatId,
        String opponentUserId,
        String eventId,
        String format,
        String matchType,
        String deckId,
        String deckName,
        List<DeckCardEntry> deckCards,
        OffsetDateTime startTime,
        OffsetDateTime endTime,
        MatchResult result,
        Integer winningTeamId,
        String winningReason,
        int totalTurns,
        List<ActionRecord> actions,
        List<LifeSnapshot> lifeSnapshots,
        List<ZoneTransferRecord> zoneTransfers,
        Map<Integer, ObjectFacts> objects
) {

    public boolean isComplete() {
        return endTime != null;
    }

    public Integer durationSeconds() {
        if (startTime == null || endTime == null) {
            return null;
        }
        return (int) Duration.between(startTime, endTime).getSeconds();
    }
}
