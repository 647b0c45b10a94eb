package com.arenastats.replay;

import com.arenastats.model.Card;
import com.arenastats.model.LifeChange;
import com.arenastats.model.Match;
import com.arenastats.model.ZoneTransfer;
import com.arenastats.parser.MatchStateReducer;
import com.arenastats.parser.model.LifeChangeRecord;
import com.arenastats.parser.model.ZoneTransferRecord;
import com.arenastats.repository.CardRepository;
import com.arenastats.repository.LifeChangeRepository;
import com.arenastats.repository.MatchRepository;
import com.arenastats.repository.ZoneTransferRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds replays for stored matches from their zone transfer and life change logs.
 */
@Service
@RequiredArgsConstructor
public class MatchReplayService {

    private static final Logger log = LoggerFactory.getLogger(MatchReplayService.class);

    private final MatchRepository matchRepository;
    private final ZoneTransferRepository zoneTransferRepository;
    private final LifeChangeRepository lifeChangeRepository;
    private final CardRepository cardRepository;
    private final ReplayRenderer replayRenderer;

    @Transactional(readOnly = true)
    public MatchReplay getReplay(String matchId) {
        Match match = matchRepository.findByMatchId(matchId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Match not found: " + matchId));

        List<ZoneTransferRecord> transfers = zoneTransferRepository.findByMatchIdOrderByIdAsc(match.getId()).stream()
                .map(MatchReplayService::toRecord)
                .toList();
        List<LifeChangeRecord> lifeChanges = lifeChangeRepository.findByMatchIdOrderByIdAsc(match.getId()).stream()
                .map(MatchReplayService::toRecord)
                .toList();

        int playerSeat = match.getPlayerSeatId() != null
                ? match.getPlayerSeatId()
                : MatchStateReducer.LOCAL_PLAYER_SEAT;
        ReplayResult result = replayRenderer.render(transfers, lifeChanges, playerSeat, match.getOpponentSeatId());

        Set<Integer> grpIds = result.steps().stream()
                .map(ReplayStep::cardGrpId)
                .collect(Collectors.toSet());
        Map<Integer, String> cardNames = new HashMap<>();
        if (!grpIds.isEmpty()) {
            for (Card card : cardRepository.findByGrpIdIn(grpIds)) {
                cardNames.put(card.getGrpId(), card.getName());
            }
        }

        log.debug("Rendered {} replay steps from {} transfers for match {} ({} zones labeled)",
                result.steps().size(), transfers.size(), matchId, result.zoneRoles().size());
        return new MatchReplay(match.getMatchId(), result, cardNames);
    }

    private static ZoneTransferRecord toRecord(ZoneTransfer transfer) {
        return new ZoneTransferRecord(
                transfer.getGameStateId(),
                transfer.getTurnNumber(),
                transfer.getInstanceId(),
                transfer.getCardGrpId(),
                transfer.getFromZone(),
                transfer.getToZone(),
                transfer.getCategory());
    }

    private static LifeChangeRecord toRecord(LifeChange change) {
        return new LifeChangeRecord(
                change.getGameStateId(),
                change.getTurnNumber(),
                change.getSeatId(),
                change.getLifeTotal(),
                change.getChangeAmount());
    }
}
