package com.arenastats.replay;

import java.util.List;

public record ReplayResult(ZoneRoleMap zoneRoles, List<ReplayStep> steps) {

    public ReplayResult {
        steps = List.copyOf(steps);
    }
}
