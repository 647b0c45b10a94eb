package com.arenastats.controller;

import com.arenastats.controller.dto.MatchReplayResponse;
import com.arenastats.replay.MatchReplayService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for match replays.
 */
@RestController
@RequestMapping("/api/matches")
@RequiredArgsConstructor
public class MatchReplayController {

    private final MatchReplayService matchReplayService;

    /**
     * Get the card-movement replay of a stored match.
     *
     * @param matchId Client match id
     * @return Zone roles and ordered replay steps
     */
    @GetMapping("/{matchId}/replay")
    public ResponseEntity<MatchReplayResponse> getReplay(@PathVariable String matchId) {
        return ResponseEntity.ok(MatchReplayResponse.from(matchReplayService.getReplay(matchId)));
    }
}
