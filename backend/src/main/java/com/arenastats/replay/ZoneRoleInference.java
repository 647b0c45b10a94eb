package com.arenastats.replay;

import com.arenastats.parser.model.ZoneTransferRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * Infers zone roles from transfer statistics. Zone ids are arbitrary per match, so roles come
 * from how objects flow between zones. Each pass labels only zones no earlier pass labeled, and
 * ties go to the zone met first in the transfer log.
 */
public final class ZoneRoleInference {

    /**
     * One labeling pass over the full transfer log.
     */
    @FunctionalInterface
    public interface Pass {
        ZoneRoleMap apply(List<ZoneTransferRecord> transfers, ZoneRoleMap roles);
    }

    private static final int STACK_MIN_ARRIVALS = 3;
    private static final int STACK_MAX_ABS_NET = 3;
    private static final int LIBRARY_MIN_DEPARTURES = 3;
    private static final int LIBRARY_MAX_NET = -3;
    private static final int EXILE_MAX_ARRIVALS = 2;

    public static final List<Pass> PASSES = List.of(
            ZoneRoleInference::battlefield,
            ZoneRoleInference::stack,
            ZoneRoleInference::opponentLibrary,
            ZoneRoleInference::opponentHand,
            ZoneRoleInference::playerLibrary,
            ZoneRoleInference::remainingHands,
            ZoneRoleInference::graveyards,
            ZoneRoleInference::exile);

    private ZoneRoleInference() {
    }

    public static ZoneRoleMap infer(List<ZoneTransferRecord> transfers) {
        ZoneRoleMap roles = ZoneRoleMap.empty();
        for (Pass pass : PASSES) {
            roles = pass.apply(transfers, roles);
        }
        return roles;
    }

    /**
     * The zone with the highest net among those with at least one named arrival.
     */
    public static ZoneRoleMap battlefield(List<ZoneTransferRecord> transfers, ZoneRoleMap roles) {
        return best(transfers, roles,
                zone -> zone.getNamedArrivals() >= 1,
                ZoneStatistics::getNet)
                .map(zoneId -> roles.with(zoneId, ZoneRole.BATTLEFIELD))
                .orElse(roles);
    }

    /**
     * A high-throughput zone whose net stays near zero.
     */
    public static ZoneRoleMap stack(List<ZoneTransferRecord> transfers, ZoneRoleMap roles) {
        return best(transfers, roles,
                zone -> zone.getNamedArrivals() >= STACK_MIN_ARRIVALS
                        && Math.abs(zone.getNet()) <= STACK_MAX_ABS_NET,
                ZoneStatistics::getNamedArrivals)
                .map(zoneId -> roles.with(zoneId, ZoneRole.STACK))
                .orElse(roles);
    }

    /**
     * The zone with the most face-down departures: the opponent's draws are hidden from us.
     */
    public static ZoneRoleMap opponentLibrary(List<ZoneTransferRecord> transfers, ZoneRoleMap roles) {
        return best(transfers, roles,
                zone -> zone.getAnonymousDepartures() >= 1,
                ZoneStatistics::getAnonymousDepartures)
                .map(zoneId -> roles.with(zoneId, ZoneRole.OPPONENT_LIBRARY))
                .orElse(roles);
    }

    /**
     * First unlabeled zone reached by a named transfer out of the opponent's library.
     */
    public static ZoneRoleMap opponentHand(List<ZoneTransferRecord> transfers, ZoneRoleMap roles) {
        Optional<Integer> opponentLibrary = roles.zoneWith(ZoneRole.OPPONENT_LIBRARY);
        if (opponentLibrary.isEmpty()) {
            return roles;
        }
        for (ZoneTransferRecord transfer : transfers) {
            if (transfer.hasCardReference()
                    && opponentLibrary.get().equals(transfer.fromZone())
                    && transfer.toZone() != null
                    && !roles.isLabeled(transfer.toZone())) {
                return roles.with(transfer.toZone(), ZoneRole.OPPONENT_HAND);
            }
        }
        return roles;
    }

    /**
     * A net source whose named departures all go to one zone. A library feeds exactly one hand,
     * a hand feeds many zones.
     */
    public static ZoneRoleMap playerLibrary(List<ZoneTransferRecord> transfers, ZoneRoleMap roles) {
        for (ZoneStatistics zone : ZoneStatistics.compute(transfers).values()) {
            if (!roles.isLabeled(zone.getZoneId())
                    && zone.getNamedDepartures() >= LIBRARY_MIN_DEPARTURES
                    && zone.getNet() <= LIBRARY_MAX_NET
                    && zone.getDistinctNamedDestinations() == 1) {
                return roles.with(zone.getZoneId(), ZoneRole.LIBRARY);
            }
        }
        return roles;
    }

    /**
     * Every unlabeled zone fed by a named transfer out of a library.
     */
    public static ZoneRoleMap remainingHands(List<ZoneTransferRecord> transfers, ZoneRoleMap roles) {
        ZoneRoleMap next = roles;
        for (ZoneTransferRecord transfer : transfers) {
            if (transfer.hasCardReference()
                    && roles.hasKind(transfer.fromZone(), ZoneRole.Kind.LIBRARY)
                    && transfer.toZone() != null
                    && !next.isLabeled(transfer.toZone())) {
                next = next.with(transfer.toZone(), ZoneRole.HAND);
            }
        }
        return next;
    }

    /**
     * Every unlabeled net sink fed by a named transfer from the battlefield or the stack.
     */
    public static ZoneRoleMap graveyards(List<ZoneTransferRecord> transfers, ZoneRoleMap roles) {
        Map<Integer, ZoneStatistics> stats = ZoneStatistics.compute(transfers);
        ZoneRoleMap next = roles;
        for (ZoneTransferRecord transfer : transfers) {
            Integer toZone = transfer.toZone();
            if (!transfer.hasCardReference() || toZone == null || next.isLabeled(toZone)) {
                continue;
            }
            boolean fromPlay = roles.hasRole(transfer.fromZone(), ZoneRole.BATTLEFIELD)
                    || roles.hasRole(transfer.fromZone(), ZoneRole.STACK);
            if (fromPlay && stats.get(toZone).getNet() >= 1) {
                next = next.with(toZone, ZoneRole.GRAVEYARD);
            }
        }
        return next;
    }

    /**
     * Every zone still unlabeled that saw only a few named arrivals.
     */
    public static ZoneRoleMap exile(List<ZoneTransferRecord> transfers, ZoneRoleMap roles) {
        ZoneRoleMap next = roles;
        for (ZoneStatistics zone : ZoneStatistics.compute(transfers).values()) {
            if (!next.isLabeled(zone.getZoneId()) && zone.getNamedArrivals() <= EXILE_MAX_ARRIVALS) {
                next = next.with(zone.getZoneId(), ZoneRole.EXILE);
            }
        }
        return next;
    }

    private static Optional<Integer> best(
            List<ZoneTransferRecord> transfers,
            ZoneRoleMap roles,
            Predicate<ZoneStatistics> eligible,
            ToIntFunction<ZoneStatistics> score) {
        ZoneStatistics best = null;
        for (ZoneStatistics zone : ZoneStatistics.compute(transfers).values()) {
            if (roles.isLabeled(zone.getZoneId()) || !eligible.test(zone)) {
                continue;
            }
            if (best == null || score.applyAsInt(zone) > score.applyAsInt(best)) {
                best = zone;
            }
        }
        return best == null ? Optional.empty() : Optional.of(best.getZoneId());
    }
}
