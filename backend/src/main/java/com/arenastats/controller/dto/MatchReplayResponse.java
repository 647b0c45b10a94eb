package com.arenastats.controller.dto;

import com.arenastats.replay.MatchReplay;
import com.arenastats.replay.ReplayStep;
import com.arenastats.replay.ZoneRoleMap;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record MatchReplayResponse(
        String matchId,
        Map<Integer, String> zoneRoles,
        List<Step> steps
) {

    public record Step(
            Integer turnNumber,
            Integer gameStateId,
            String actor,
            String verb,
            int cardGrpId,
            String cardName,
            Integer instanceId,
            Integer fromZone,
            String fromZoneRole,
            Integer toZone,
            String toZoneRole,
            Integer playerLife,
            Integer opponentLife
    ) {
    }

    public static MatchReplayResponse from(MatchReplay replay) {
        ZoneRoleMap roles = replay.result().zoneRoles();
        Map<Integer, String> zoneRoles = new LinkedHashMap<>();
        roles.asMap().forEach((zoneId, role) -> zoneRoles.put(zoneId, role.getLabel()));

        List<Step> steps = replay.result().steps().stream()
                .map(step -> toStep(step, roles, replay))
                .toList();
        return new MatchReplayResponse(replay.matchId(), zoneRoles, steps);
    }

    private static Step toStep(ReplayStep step, ZoneRoleMap roles, MatchReplay replay) {
        return new Step(
                step.turnNumber(),
                step.gameStateId(),
                step.actor().getValue(),
                step.verb(),
                step.cardGrpId(),
                replay.cardName(step.cardGrpId()),
                step.instanceId(),
                step.fromZone(),
                step.fromZone() == null ? null : roles.labelOf(step.fromZone()),
                step.toZone(),
                step.toZone() == null ? null : roles.labelOf(step.toZone()),
                step.playerLife(),
                step.opponentLife()
        );
    }
}
