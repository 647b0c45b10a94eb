package com.arenastats.replay;

/**
 * One rendered card movement with the life totals in effect at that point.
 */
public record ReplayStep(
        Integer turnNumber,
        Integer gameStateId,
        ReplayActor actor,
        String verb,
        int cardGrpId,
        Integer instanceId,
        Integer fromZone,
        Integer toZone,
        Integer playerLife,
        Integer opponentLife
) {
}
