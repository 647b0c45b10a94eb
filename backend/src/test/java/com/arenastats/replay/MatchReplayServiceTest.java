package com.arenastats.replay;

import com.arenastats.model.Card;
import com.arenastats.model.LifeChange;
import com.arenastats.model.Match;
import com.arenastats.model.ZoneTransfer;
import com.arenastats.parser.model.ZoneTransferRecord;
import com.arenastats.repository.CardRepository;
import com.arenastats.repository.LifeChangeRepository;
import com.arenastats.repository.MatchRepository;
import com.arenastats.repository.ZoneTransferRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MatchReplayServiceTest {

    @Mock
    private MatchRepository matchRepository;

    @Mock
    private ZoneTransferRepository zoneTransferRepository;

    @Mock
    private LifeChangeRepository lifeChangeRepository;

    @Mock
    private CardRepository cardRepository;

    private MatchReplayService service;

    @BeforeEach
    void setUp() {
        service = new MatchReplayService(matchRepository, zoneTransferRepository, lifeChangeRepository,
                cardRepository, new ReplayRenderer());
    }

    @Test
    void getReplay_rendersStoredTransfersWithCardNames() {
        Match match = match(7L, "m-1", 2, 1);
        when(matchRepository.findByMatchId("m-1")).thenReturn(Optional.of(match));
        when(zoneTransferRepository.findByMatchIdOrderByIdAsc(7L))
                .thenReturn(TransferLog.ourGame().build().stream().map(MatchReplayServiceTest::entity).toList());
        when(lifeChangeRepository.findByMatchIdOrderByIdAsc(7L)).thenReturn(List.of(life(1, 2, 20), life(1, 1, 20)));
        when(cardRepository.findByGrpIdIn(any())).thenReturn(List.of(card(2001, "Shock"), card(4001, "Mountain")));

        MatchReplay replay = service.getReplay("m-1");

        assertEquals("m-1", replay.matchId());
        assertEquals(29, replay.result().steps().size());
        assertEquals("Shock", replay.cardName(2001));
        assertNull(replay.cardName(1001));
        assertEquals(20, replay.result().steps().get(0).opponentLife());
        assertEquals(ZoneRole.LIBRARY, replay.result().zoneRoles().roleOf(TransferLog.LIBRARY).orElseThrow());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<Collection<Integer>> grpIds = ArgumentCaptor.forClass(Collection.class);
        verify(cardRepository).findByGrpIdIn(grpIds.capture());
        assertEquals(13, grpIds.getValue().size());
        assertTrue(grpIds.getValue().containsAll(Set.of(1001, 2001, 3001, 4001)));
    }

    @Test
    void getReplay_defaultsToLocalSeatAndSkipsNameLookupForEmptyReplay() {
        Match match = match(8L, "m-2", null, null);
        when(matchRepository.findByMatchId("m-2")).thenReturn(Optional.of(match));
        when(zoneTransferRepository.findByMatchIdOrderByIdAsc(8L)).thenReturn(List.of());
        when(lifeChangeRepository.findByMatchIdOrderByIdAsc(8L)).thenReturn(List.of());

        MatchReplay replay = service.getReplay("m-2");

        assertTrue(replay.result().steps().isEmpty());
        assertEquals(0, replay.result().zoneRoles().size());
        verify(cardRepository, never()).findByGrpIdIn(any());
    }

    @Test
    void getReplay_unknownMatchIsNotFound() {
        when(matchRepository.findByMatchId("missing")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> service.getReplay("missing"));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
        verifyNoInteractions(zoneTransferRepository, lifeChangeRepository, cardRepository);
    }

    private static Match match(Long id, String matchId, Integer playerSeat, Integer opponentSeat) {
        Match match = new Match();
        match.setId(id);
        match.setMatchId(matchId);
        match.setPlayerSeatId(playerSeat);
        match.setOpponentSeatId(opponentSeat);
        return match;
    }

    private static ZoneTransfer entity(ZoneTransferRecord record) {
        ZoneTransfer transfer = new ZoneTransfer();
        transfer.setGameStateId(record.gameStateId());
        transfer.setTurnNumber(record.turnNumber());
        transfer.setInstanceId(record.instanceId());
        transfer.setCardGrpId(record.grpId());
        transfer.setFromZone(record.fromZone());
        transfer.setToZone(record.toZone());
        transfer.setCategory(record.category());
        return transfer;
    }

    private static LifeChange life(int gameStateId, int seatId, int lifeTotal) {
        LifeChange change = new LifeChange();
        change.setGameStateId(gameStateId);
        change.setTurnNumber(1);
        change.setSeatId(seatId);
        change.setLifeTotal(lifeTotal);
        return change;
    }

    private static Card card(int grpId, String name) {
        Card card = new Card();
        card.setGrpId(grpId);
        card.setName(name);
        return card;
    }
}
