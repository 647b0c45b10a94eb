package com.arenastats.parser;

import com.arenastats.parser.model.ActionRecord;
import com.arenastats.parser.model.DeckCardEntry;
import com.arenastats.parser.model.LifeSnapshot;
import com.arenastats.parser.model.MatchAggregate;
import com.arenastats.parser.model.MatchResult;
import com.arenastats.parser.model.ObjectFacts;
import com.arenastats.parser.model.ZoneTransferRecord;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Working state of the open match. Owned by exactly one {@link ParserState} at a time.
 */
class MatchAccumulator {

    final String matchId;
    String playerName;
    Integer playerSeatId;
    String playerUserId;
    String opponentName;
    Integer opponentSeatId;
    String opponentUserId;
    String eventId;
    String format;
    String matchType;
    String deckId;
    String deckName;
    List<DeckCardEntry> deckCards = List.of();
    OffsetDateTime startTime;
    OffsetDateTime endTime;
    MatchResult result;
    Integer winningTeamId;
    String winningReason;
    int totalTurns;

    private final List<ActionRecord> actions = new ArrayList<>();
    private final Set<ActionRecord.DedupKey> actionKeys = new HashSet<>();
    private final List<LifeSnapshot> lifeSnapshots = new ArrayList<>();
    private final List<ZoneTransferRecord> zoneTransfers = new ArrayList<>();
    private final Map<Integer, ObjectFacts> objects = new LinkedHashMap<>();

    MatchAccumulator(String matchId, OffsetDateTime startTime) {
        this.matchId = matchId;
        this.startTime = startTime;
    }

    /**
     * Records an action unless one with the same dedup key is already present.
     */
    void addAction(ActionRecord action) {
        if (actionKeys.add(action.dedupKey())) {
            actions.add(action);
        }
    }

    void addLifeSnapshot(LifeSnapshot snapshot) {
        lifeSnapshots.add(snapshot);
    }

    void addZoneTransfer(ZoneTransferRecord transfer) {
        zoneTransfers.add(transfer);
    }

    void putObject(int instanceId, ObjectFacts facts) {
        objects.put(instanceId, facts);
    }

    ObjectFacts object(Integer instanceId) {
        return instanceId == null ? null : objects.get(instanceId);
    }

    MatchAggregate toAggregate() {
        return new MatchAggregate(
                matchId,
                playerName,
                playerSeatId,
                playerUserId,
                opponentName,
                opponentSeatId,
                opponentUserId,
                eventId,
                format,
                matchType,
                deckId,
                deckName,
                deckCards,
                startTime,
                endTime,
                result,
                winningTeamId,
                winningReason,
                totalTurns,
                List.copyOf(actions),
                List.copyOf(lifeSnapshots),
                List.copyOf(zoneTransfers),
                Collections.unmodifiableMap(new LinkedHashMap<>(objects)));
    }
}
