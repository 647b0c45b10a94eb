package com.arenastats.service;

import com.arenastats.cards.CardClassification;
import com.arenastats.cards.CardNameResolver;
import com.arenastats.cards.CardObjectClassifier;
import com.arenastats.cards.ResolvedCard;
import com.arenastats.config.ArenaStatsProperties;
import com.arenastats.model.Card;
import com.arenastats.model.Deck;
import com.arenastats.model.DeckCard;
import com.arenastats.model.GameAction;
import com.arenastats.model.ImportSession;
import com.arenastats.model.ImportSessionStatus;
import com.arenastats.model.LifeChange;
import com.arenastats.model.Match;
import com.arenastats.model.UnknownCard;
import com.arenastats.model.ZoneTransfer;
import com.arenastats.parser.LifeChangeCalculator;
import com.arenastats.parser.MatchLogParser;
import com.arenastats.parser.ParseResult;
import com.arenastats.parser.model.ActionRecord;
import com.arenastats.parser.model.DeckCardEntry;
import com.arenastats.parser.model.LifeChangeRecord;
import com.arenastats.parser.model.MatchAggregate;
import com.arenastats.parser.model.ObjectFacts;
import com.arenastats.parser.model.ZoneTransferRecord;
import com.arenastats.repository.CardRepository;
import com.arenastats.repository.DeckCardRepository;
import com.arenastats.repository.DeckRepository;
import com.arenastats.repository.GameActionRepository;
import com.arenastats.repository.ImportSessionRepository;
import com.arenastats.repository.LifeChangeRepository;
import com.arenastats.repository.MatchRepository;
import com.arenastats.repository.UnknownCardRepository;
import com.arenastats.repository.ZoneTransferRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Imports parsed matches into the database, one transaction per match.
 */
@Service
@RequiredArgsConstructor
public class MatchImportService {

    private static final Logger log = LoggerFactory.getLogger(MatchImportService.class);

    /**
     * Action types worth keeping. Everything else the engine offers is noise for statistics.
     */
    static final Set<String> SIGNIFICANT_ACTION_TYPES = Set.of(
            "ActionType_Cast",
            "ActionType_Play",
            "ActionType_Attack",
            "ActionType_Block",
            "ActionType_Activate",
            "ActionType_Activate_Mana",
            "ActionType_Resolution");

    private static final String UNKNOWN_DECK_NAME = "Unknown Deck";

    private final MatchRepository matchRepository;
    private final DeckRepository deckRepository;
    private final DeckCardRepository deckCardRepository;
    private final CardRepository cardRepository;
    private final GameActionRepository gameActionRepository;
    private final LifeChangeRepository lifeChangeRepository;
    private final ZoneTransferRepository zoneTransferRepository;
    private final ImportSessionRepository importSessionRepository;
    private final UnknownCardRepository unknownCardRepository;
    private final CardObjectClassifier cardObjectClassifier;
    private final CardNameResolver cardNameResolver;
    private final ArenaStatsProperties properties;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;

    /**
     * Parses a log file and stores every match not yet imported.
     *
     * @param logPath Client log to import
     * @param force Re-import matches stored by earlier runs, replacing them
     * @return Counts for the run
     * @throws com.arenastats.parser.LogParseException if the file cannot be parsed at all
     */
    public ImportSummary importLog(Path logPath, boolean force) {
        ImportSession session = importSessionRepository.save(newSession(logPath));

        try {
            ParseResult parsed = new MatchLogParser(
                    logPath, objectMapper, properties.getParser().getMaxBufferedLines()).parseMatches();

            // Grows with every match this run imports, so a repeated match id is stored once.
            Set<String> importedMatchIds = force ? new HashSet<>() : new HashSet<>(matchRepository.findAllMatchIds());
            if (!force) {
                log.debug("Found {} existing matches", importedMatchIds.size());
            }

            int imported = 0;
            int skipped = 0;
            int failed = 0;
            for (MatchAggregate match : parsed.matches()) {
                if (importedMatchIds.contains(match.matchId())) {
                    skipped++;
                    log.debug("Skipping already imported match {}", match.matchId());
                    continue;
                }
                try {
                    transactionTemplate.execute(status -> {
                        if (force) {
                            matchRepository.deleteByMatchId(match.matchId());
                        }
                        return importMatch(match, session);
                    });
                    importedMatchIds.add(match.matchId());
                    imported++;
                    log.info("Imported match {} vs {} ({})",
                            match.matchId(),
                            match.opponentName(),
                            match.result() == null ? "incomplete" : match.result().getValue());
                } catch (RuntimeException e) {
                    failed++;
                    log.error("Failed to import match {}", match.matchId(), e);
                }
            }

            session.setMatchesImported(imported);
            session.setMatchesSkipped(skipped);
            session.setMatchesFailed(failed);
            session.setParseErrors(parsed.errors().size());
            session.setStatus(ImportSessionStatus.COMPLETED);
            session.setCompletedAt(OffsetDateTime.now());
            importSessionRepository.save(session);

            log.info("Import of {} complete: {} imported, {} skipped, {} failed, {} parse errors",
                    logPath, imported, skipped, failed, parsed.errors().size());
            return new ImportSummary(
                    session.getId(), parsed.matches().size(), imported, skipped, failed, parsed.errors().size());
        } catch (RuntimeException e) {
            session.setStatus(ImportSessionStatus.FAILED);
            session.setErrorMessage(e.getMessage());
            session.setCompletedAt(OffsetDateTime.now());
            importSessionRepository.save(session);
            throw e;
        }
    }

    Match importMatch(MatchAggregate aggregate, ImportSession session) {
        Deck deck = aggregate.deckId() == null ? null : ensureDeck(aggregate, session);

        Match match = new Match();
        match.setMatchId(aggregate.matchId());
        match.setPlayerSeatId(aggregate.playerSeatId());
        match.setPlayerName(aggregate.playerName());
        match.setPlayerUserId(aggregate.playerUserId());
        match.setOpponentSeatId(aggregate.opponentSeatId());
        match.setOpponentName(aggregate.opponentName());
        match.setOpponentUserId(aggregate.opponentUserId());
        match.setDeck(deck);
        match.setEventId(aggregate.eventId());
        match.setFormat(aggregate.format());
        match.setMatchType(aggregate.matchType());
        match.setResult(aggregate.result() == null ? null : aggregate.result().getValue());
        match.setWinningTeamId(aggregate.winningTeamId());
        match.setWinningReason(aggregate.winningReason());
        match.setStartTime(aggregate.startTime());
        match.setEndTime(aggregate.endTime());
        match.setDurationSeconds(aggregate.durationSeconds());
        match.setTotalTurns(aggregate.totalTurns());
        match = matchRepository.save(match);

        CardClassification classification = cardObjectClassifier.classify(aggregate);
        ensureCards(classification.realCardIds(), classification.specialObjects(), session, match, deck);

        importActions(match, aggregate.actions());
        importLifeChanges(match, LifeChangeCalculator.diff(aggregate.lifeSnapshots()));
        importZoneTransfers(match, aggregate.zoneTransfers());
        return match;
    }

    private Deck ensureDeck(MatchAggregate aggregate, ImportSession session) {
        Deck existing = deckRepository.findByDeckId(aggregate.deckId()).orElse(null);
        if (existing != null) {
            return existing;
        }

        Deck deck = new Deck();
        deck.setDeckId(aggregate.deckId());
        deck.setName(aggregate.deckName() != null ? aggregate.deckName() : UNKNOWN_DECK_NAME);
        deck.setFormat(aggregate.format());
        deck = deckRepository.save(deck);

        Map<Integer, Integer> quantities = new LinkedHashMap<>();
        for (DeckCardEntry entry : aggregate.deckCards()) {
            if (entry.cardId() != 0) {
                quantities.merge(entry.cardId(), entry.quantity(), Integer::sum);
            }
        }
        if (quantities.isEmpty()) {
            return deck;
        }

        ensureCards(quantities.keySet(), Map.of(), session, null, deck);
        List<DeckCard> deckCards = new ArrayList<>(quantities.size());
        for (Map.Entry<Integer, Integer> entry : quantities.entrySet()) {
            DeckCard deckCard = new DeckCard();
            deckCard.setDeck(deck);
            deckCard.setCardGrpId(entry.getKey());
            deckCard.setQuantity(entry.getValue());
            deckCards.add(deckCard);
        }
        deckCardRepository.saveAll(deckCards);
        return deck;
    }

    private void ensureCards(
            Set<Integer> realCardIds,
            Map<Integer, ObjectFacts> specialObjects,
            ImportSession session,
            Match match,
            Deck deck) {
        Set<Integer> allIds = new LinkedHashSet<>(realCardIds);
        allIds.addAll(specialObjects.keySet());
        if (allIds.isEmpty()) {
            return;
        }

        Set<Integer> existingIds = cardRepository.findExistingGrpIds(allIds);
        Set<Integer> missingReal = new LinkedHashSet<>(realCardIds);
        missingReal.removeAll(existingIds);
        Map<Integer, ObjectFacts> missingSpecial = new LinkedHashMap<>();
        specialObjects.forEach((grpId, facts) -> {
            if (!existingIds.contains(grpId)) {
                missingSpecial.put(grpId, facts);
            }
        });
        if (missingReal.isEmpty() && missingSpecial.isEmpty()) {
            return;
        }
        log.info("Looking up {} cards, naming {} special objects", missingReal.size(), missingSpecial.size());

        List<Card> cards = new ArrayList<>();
        List<UnknownCard> unknownCards = new ArrayList<>();
        for (ResolvedCard resolved : cardNameResolver.resolveRealCards(missingReal)) {
            cards.add(toCard(resolved));
            if (!resolved.found()) {
                log.warn("Unknown card: grpId={}, deck={}, match={}",
                        resolved.grpId(),
                        deck == null ? "N/A" : deck.getName(),
                        match == null ? "N/A" : match.getMatchId());
                unknownCards.add(unknownCard(resolved.grpId(), session, match, deck));
            }
        }
        for (ResolvedCard resolved : cardNameResolver.resolveSpecialObjects(missingSpecial)) {
            cards.add(toCard(resolved));
        }

        cardRepository.saveAll(cards);
        if (!unknownCards.isEmpty()) {
            unknownCardRepository.saveAll(unknownCards);
            log.warn("Logged {} unknown cards for review", unknownCards.size());
        }
    }

    private Card toCard(ResolvedCard resolved) {
        Card card = new Card();
        card.setGrpId(resolved.grpId());
        card.setName(resolved.name());
        card.setIsToken(resolved.token());
        card.setObjectType(resolved.objectType());
        card.setSourceGrpId(resolved.sourceGrpId());
        if (resolved.facts() != null) {
            card.setManaCost(resolved.facts().manaCost());
            card.setCmc(resolved.facts().cmc());
            card.setTypeLine(resolved.facts().typeLine());
            card.setColors(new ArrayList<>(resolved.facts().colors()));
            card.setColorIdentity(new ArrayList<>(resolved.facts().colorIdentity()));
            card.setSetCode(resolved.facts().setCode());
            card.setRarity(resolved.facts().rarity());
            card.setOracleText(resolved.facts().oracleText());
            card.setPower(resolved.facts().power());
            card.setToughness(resolved.facts().toughness());
            card.setScryfallId(resolved.facts().scryfallId());
            card.setImageUri(resolved.facts().imageUri());
        }
        return card;
    }

    private UnknownCard unknownCard(int grpId, ImportSession session, Match match, Deck deck) {
        ObjectNode context = objectMapper.createObjectNode();
        context.put("grp_id", grpId);
        context.put("import_session_id", session.getId());
        context.put("match_id", match == null ? null : match.getMatchId());
        context.put("deck_id", deck == null ? null : deck.getDeckId());
        context.put("deck_name", deck == null ? null : deck.getName());

        UnknownCard unknownCard = new UnknownCard();
        unknownCard.setGrpId(grpId);
        unknownCard.setMatch(match);
        unknownCard.setDeck(deck);
        unknownCard.setImportSession(session);
        unknownCard.setRawData(context);
        return unknownCard;
    }

    private void importActions(Match match, List<ActionRecord> actions) {
        Set<ActionRecord.DedupKey> seen = new HashSet<>();
        List<GameAction> rows = new ArrayList<>();
        for (ActionRecord action : actions) {
            if (action.actionType() == null || !SIGNIFICANT_ACTION_TYPES.contains(action.actionType())) {
                continue;
            }
            if (!seen.add(action.dedupKey())) {
                continue;
            }
            GameAction row = new GameAction();
            row.setMatch(match);
            row.setGameStateId(action.gameStateId());
            row.setTurnNumber(action.turnNumber());
            row.setPhase(action.phase());
            row.setStep(action.step());
            row.setActivePlayerSeat(action.activePlayerSeat());
            row.setSeatId(action.seatId());
            row.setActionType(action.actionType());
            row.setInstanceId(action.instanceId());
            row.setCardGrpId(action.cardGrpId());
            row.setAbilityGrpId(action.abilityGrpId());
            row.setManaCost(action.manaCost());
            row.setTimestampMs(action.timestampMs());
            rows.add(row);
        }
        gameActionRepository.saveAll(rows);
    }

    private void importLifeChanges(Match match, List<LifeChangeRecord> changes) {
        List<LifeChange> rows = new ArrayList<>(changes.size());
        for (LifeChangeRecord change : changes) {
            LifeChange row = new LifeChange();
            row.setMatch(match);
            row.setGameStateId(change.gameStateId());
            row.setTurnNumber(change.turnNumber());
            row.setSeatId(change.seatId());
            row.setLifeTotal(change.lifeTotal());
            row.setChangeAmount(change.changeAmount());
            rows.add(row);
        }
        lifeChangeRepository.saveAll(rows);
    }

    private void importZoneTransfers(Match match, List<ZoneTransferRecord> transfers) {
        Set<Integer> candidateIds = new HashSet<>();
        for (ZoneTransferRecord transfer : transfers) {
            if (transfer.grpId() != null) {
                candidateIds.add(transfer.grpId());
            }
        }
        // Engine-internal objects are never stored as cards, so their ids cannot be referenced.
        Set<Integer> storedIds = candidateIds.isEmpty() ? Set.of() : cardRepository.findExistingGrpIds(candidateIds);

        Set<TransferKey> seen = new HashSet<>();
        List<ZoneTransfer> rows = new ArrayList<>();
        for (ZoneTransferRecord transfer : transfers) {
            if (!seen.add(new TransferKey(transfer.gameStateId(), transfer.instanceId(), transfer.category()))) {
                continue;
            }
            ZoneTransfer row = new ZoneTransfer();
            row.setMatch(match);
            row.setGameStateId(transfer.gameStateId());
            row.setTurnNumber(transfer.turnNumber());
            row.setInstanceId(transfer.instanceId());
            row.setCardGrpId(transfer.grpId() != null && storedIds.contains(transfer.grpId()) ? transfer.grpId() : null);
            row.setFromZone(transfer.fromZone());
            row.setToZone(transfer.toZone());
            row.setCategory(transfer.category());
            rows.add(row);
        }
        zoneTransferRepository.saveAll(rows);
    }

    private static ImportSession newSession(Path logPath) {
        ImportSession session = new ImportSession();
        session.setLogFile(logPath.toString());
        try {
            if (Files.isRegularFile(logPath)) {
                session.setFileSize(Files.size(logPath));
                session.setFileModified(OffsetDateTime.ofInstant(
                        Files.getLastModifiedTime(logPath).toInstant(), ZoneOffset.UTC));
            }
        } catch (IOException e) {
            log.debug("Could not read file attributes of {}", logPath, e);
        }
        return session;
    }

    private record TransferKey(Integer gameStateId, Integer instanceId, String category) {
    }
}
