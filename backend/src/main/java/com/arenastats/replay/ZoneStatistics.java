package com.arenastats.replay;

import com.arenastats.parser.model.ZoneTransferRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Transfer counts for one zone. "Named" transfers carry a card reference, anonymous ones do not.
 */
public final class ZoneStatistics {

    private final int zoneId;
    private int namedArrivals;
    private int namedDepartures;
    private int anonymousDepartures;
    private final Set<Integer> namedDestinations = new LinkedHashSet<>();

    private ZoneStatistics(int zoneId) {
        this.zoneId = zoneId;
    }

    /**
     * Computes statistics for every zone in the log, keyed in order of first appearance.
     *
     * @param transfers Zone transfers in log order
     * @return Statistics per zone id
     */
    public static Map<Integer, ZoneStatistics> compute(List<ZoneTransferRecord> transfers) {
        Map<Integer, ZoneStatistics> stats = new LinkedHashMap<>();
        for (ZoneTransferRecord transfer : transfers) {
            ZoneStatistics from = transfer.fromZone() == null
                    ? null
                    : stats.computeIfAbsent(transfer.fromZone(), ZoneStatistics::new);
            ZoneStatistics to = transfer.toZone() == null
                    ? null
                    : stats.computeIfAbsent(transfer.toZone(), ZoneStatistics::new);

            if (transfer.hasCardReference()) {
                if (from != null) {
                    from.namedDepartures++;
                    if (to != null) {
                        from.namedDestinations.add(to.zoneId);
                    }
                }
                if (to != null) {
                    to.namedArrivals++;
                }
            } else if (from != null) {
                from.anonymousDepartures++;
            }
        }
        return Collections.unmodifiableMap(stats);
    }

    public int getZoneId() {
        return zoneId;
    }

    public int getNamedArrivals() {
        return namedArrivals;
    }

    public int getNamedDepartures() {
        return namedDepartures;
    }

    public int getAnonymousDepartures() {
        return anonymousDepartures;
    }

    public int getNet() {
        return namedArrivals - namedDepartures;
    }

    public int getDistinctNamedDestinations() {
        return namedDestinations.size();
    }
}
