package com.arenastats.parser;

import com.arenastats.parser.model.LifeChangeRecord;
import com.arenastats.parser.model.LifeSnapshot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns raw per-state life snapshots into life changes.
 */
public final class LifeChangeCalculator {

    private LifeChangeCalculator() {
    }

    /**
     * Walks the snapshots in order. The first sighting of a seat is kept with a null change;
     * later snapshots are kept only when the seat's total moved.
     *
     * @param snapshots Life snapshots in log order
     * @return Recorded life changes, never with a zero change amount
     */
    public static List<LifeChangeRecord> diff(List<LifeSnapshot> snapshots) {
        Map<Integer, Integer> previousLife = new HashMap<>();
        List<LifeChangeRecord> changes = new ArrayList<>();

        for (LifeSnapshot snapshot : snapshots) {
            Integer previous = previousLife.get(snapshot.seatId());
            Integer change = null;
            if (previous != null) {
                change = snapshot.lifeTotal() - previous;
                if (change == 0) {
                    continue;
                }
            }
            previousLife.put(snapshot.seatId(), snapshot.lifeTotal());
            changes.add(new LifeChangeRecord(
                    snapshot.gameStateId(),
                    snapshot.turnNumber(),
                    snapshot.seatId(),
                    snapshot.lifeTotal(),
                    change));
        }
        return changes;
    }
}
