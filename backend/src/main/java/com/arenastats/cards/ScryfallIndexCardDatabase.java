package com.arenastats.cards;

import com.arenastats.config.ArenaStatsProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Card database backed by the Arena-id index file the bulk card download job writes.
 * The index is read once, on first lookup.
 */
@Component
public class ScryfallIndexCardDatabase implements CardDatabaseClient {

    private static final Logger log = LoggerFactory.getLogger(ScryfallIndexCardDatabase.class);

    private static final TypeReference<Map<String, CardFacts>> INDEX_TYPE = new TypeReference<>() {
    };

    private final Path indexPath;
    private final ObjectMapper objectMapper;

    private volatile Map<Integer, CardFacts> index;

    public ScryfallIndexCardDatabase(ArenaStatsProperties properties, ObjectMapper objectMapper) {
        this.indexPath = Paths.get(properties.getCards().getIndexPath());
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<CardFacts> lookup(int arenaId) {
        return Optional.ofNullable(index().get(arenaId));
    }

    @Override
    public Map<Integer, Optional<CardFacts>> lookupMany(Set<Integer> arenaIds) {
        Map<Integer, CardFacts> loaded = index();
        Map<Integer, Optional<CardFacts>> result = new LinkedHashMap<>();
        for (Integer arenaId : arenaIds) {
            result.put(arenaId, Optional.ofNullable(loaded.get(arenaId)));
        }
        return result;
    }

    public int size() {
        return index().size();
    }

    private Map<Integer, CardFacts> index() {
        Map<Integer, CardFacts> loaded = index;
        if (loaded == null) {
            synchronized (this) {
                loaded = index;
                if (loaded == null) {
                    loaded = loadIndex();
                    index = loaded;
                }
            }
        }
        return loaded;
    }

    private Map<Integer, CardFacts> loadIndex() {
        if (!Files.isRegularFile(indexPath)) {
            log.warn("Card index {} not found; every card lookup will miss", indexPath);
            return Map.of();
        }
        try {
            Map<String, CardFacts> raw = objectMapper.readValue(indexPath.toFile(), INDEX_TYPE);
            Map<Integer, CardFacts> byArenaId = new HashMap<>(raw.size() * 2);
            raw.forEach((key, facts) -> {
                if (facts == null) {
                    return;
                }
                try {
                    byArenaId.put(Integer.parseInt(key.trim()), facts);
                } catch (NumberFormatException e) {
                    log.debug("Skipping card index entry with non-numeric key '{}'", key);
                }
            });
            log.info("Loaded {} cards from index {}", byArenaId.size(), indexPath);
            return Map.copyOf(byArenaId);
        } catch (IOException e) {
            log.warn("Failed to load card index {}; every card lookup will miss", indexPath, e);
            return Map.of();
        }
    }
}
