package com.arenastats.replay;

import com.arenastats.parser.model.LifeChangeRecord;
import com.arenastats.parser.model.ZoneTransferRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renders a match's zone transfers as readable replay steps.
 */
@Component
public class ReplayRenderer {

    public static final String VERB_TOKEN_CREATED = "token created";

    private static final Map<ZoneRole.Kind, Map<ZoneRole.Kind, String>> VERBS = new EnumMap<>(ZoneRole.Kind.class);

    static {
        verb(ZoneRole.Kind.HAND, ZoneRole.Kind.BATTLEFIELD, "entered the battlefield");
        verb(ZoneRole.Kind.STACK, ZoneRole.Kind.BATTLEFIELD, "entered the battlefield");
        verb(ZoneRole.Kind.LIBRARY, ZoneRole.Kind.BATTLEFIELD, "put onto the battlefield");
        verb(ZoneRole.Kind.HAND, ZoneRole.Kind.STACK, "cast");
        verb(ZoneRole.Kind.BATTLEFIELD, ZoneRole.Kind.GRAVEYARD, "died");
        verb(ZoneRole.Kind.BATTLEFIELD, ZoneRole.Kind.EXILE, "was exiled");
        verb(ZoneRole.Kind.STACK, ZoneRole.Kind.EXILE, "was exiled");
        verb(ZoneRole.Kind.BATTLEFIELD, ZoneRole.Kind.HAND, "bounced to hand");
        verb(ZoneRole.Kind.BATTLEFIELD, ZoneRole.Kind.LIBRARY, "shuffled into library");
        verb(ZoneRole.Kind.STACK, ZoneRole.Kind.GRAVEYARD, "resolved");
        verb(ZoneRole.Kind.LIBRARY, ZoneRole.Kind.HAND, "drawn");
    }

    private static void verb(ZoneRole.Kind from, ZoneRole.Kind to, String verb) {
        VERBS.computeIfAbsent(from, k -> new EnumMap<>(ZoneRole.Kind.class)).put(to, verb);
    }

    /**
     * Infers zone roles and renders the replay.
     *
     * @param transfers Zone transfers in insertion order
     * @param lifeChanges Life changes in insertion order
     * @param playerSeatId Seat of the local player
     * @param opponentSeatId Seat of the opponent, or null to take the first other seat with a life record
     * @return Zone roles and ordered replay steps
     */
    public ReplayResult render(
            List<ZoneTransferRecord> transfers,
            List<LifeChangeRecord> lifeChanges,
            int playerSeatId,
            Integer opponentSeatId) {
        ZoneRoleMap roles = ZoneRoleInference.infer(transfers);
        Optional<Integer> playerHand = playerHandZone(transfers, roles);
        Integer opponentSeat = opponentSeatId != null ? opponentSeatId : firstOtherSeat(lifeChanges, playerSeatId);

        List<LifeChangeRecord> lifeLog = new ArrayList<>(lifeChanges);
        lifeLog.sort(Comparator.comparingInt(change -> orZero(change.gameStateId())));
        Map<Integer, Integer> life = new HashMap<>();
        int lifeCursor = 0;

        List<ReplayStep> steps = new ArrayList<>();
        for (ZoneTransferRecord transfer : transfers) {
            if (!transfer.hasCardReference()) {
                continue;
            }
            int gameStateId = orZero(transfer.gameStateId());
            while (lifeCursor < lifeLog.size() && orZero(lifeLog.get(lifeCursor).gameStateId()) <= gameStateId) {
                LifeChangeRecord change = lifeLog.get(lifeCursor++);
                life.put(change.seatId(), change.lifeTotal());
            }

            String verb;
            ReplayActor actor;
            if (transfer.isTokenCreation()) {
                verb = VERB_TOKEN_CREATED;
                actor = actorFor(transfer.fromZone(), playerHand, roles);
            } else {
                Optional<ZoneRole> from = roles.roleOf(transfer.fromZone());
                Optional<ZoneRole> to = roles.roleOf(transfer.toZone());
                if (from.isEmpty() || to.isEmpty()) {
                    continue;
                }
                verb = VERBS.getOrDefault(from.get().getKind(), Map.of()).get(to.get().getKind());
                if (verb == null) {
                    continue;
                }
                boolean draw = from.get().getKind() == ZoneRole.Kind.LIBRARY
                        && to.get().getKind() == ZoneRole.Kind.HAND;
                actor = actorFor(draw ? transfer.toZone() : transfer.fromZone(), playerHand, roles);
            }

            steps.add(new ReplayStep(
                    transfer.turnNumber(),
                    transfer.gameStateId(),
                    actor,
                    verb,
                    transfer.grpId(),
                    transfer.instanceId(),
                    transfer.fromZone(),
                    transfer.toZone(),
                    life.get(playerSeatId),
                    opponentSeat == null ? null : life.get(opponentSeat)));
        }
        return new ReplayResult(roles, steps);
    }

    /**
     * The local player's hand: the first Hand zone fed by a named transfer from a library.
     * The opponent's library feeds face down, so only our hand shows up here.
     */
    static Optional<Integer> playerHandZone(List<ZoneTransferRecord> transfers, ZoneRoleMap roles) {
        for (ZoneTransferRecord transfer : transfers) {
            if (transfer.hasCardReference()
                    && roles.hasKind(transfer.fromZone(), ZoneRole.Kind.LIBRARY)
                    && roles.hasRole(transfer.toZone(), ZoneRole.HAND)) {
                return Optional.of(transfer.toZone());
            }
        }
        return Optional.empty();
    }

    private static ReplayActor actorFor(Integer zoneId, Optional<Integer> playerHand, ZoneRoleMap roles) {
        if (zoneId != null && playerHand.isPresent() && playerHand.get().equals(zoneId)) {
            return ReplayActor.YOU;
        }
        if (roles.hasRole(zoneId, ZoneRole.OPPONENT_HAND)) {
            return ReplayActor.OPPONENT;
        }
        return ReplayActor.UNKNOWN;
    }

    private static Integer firstOtherSeat(List<LifeChangeRecord> lifeChanges, int playerSeatId) {
        return lifeChanges.stream()
                .map(LifeChangeRecord::seatId)
                .filter(seat -> seat != playerSeatId)
                .findFirst()
                .orElse(null);
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
