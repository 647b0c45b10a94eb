package com.arenastats.cards;

import com.arenastats.config.ArenaStatsProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScryfallIndexCardDatabaseTest {

    @TempDir
    Path dir;

    @Test
    void lookup_readsEntriesKeyedByArenaId() throws IOException {
        Path index = dir.resolve("arena_id_index.json");
        Files.writeString(index, """
                {
                  "75000": {
                    "name": "Llanowar Elves",
                    "mana_cost": "{G}",
                    "cmc": 1.0,
                    "type_line": "Creature - Elf Druid",
                    "colors": ["G"],
                    "set_code": "dom",
                    "rarity": "common",
                    "power": "1",
                    "toughness": "1",
                    "legalities": {"standard": "not_legal"}
                  },
                  "not-a-number": {"name": "Ignored"},
                  "75001": null
                }
                """, StandardCharsets.UTF_8);

        ScryfallIndexCardDatabase database = database(index);

        CardFacts elves = database.lookup(75000).orElseThrow();
        assertEquals("Llanowar Elves", elves.name());
        assertEquals("{G}", elves.manaCost());
        assertEquals(1.0, elves.cmc());
        assertEquals(List.of("G"), elves.colors());
        assertTrue(elves.colorIdentity().isEmpty());
        assertEquals(1, database.size());
        assertEquals(Map.of(75000, Optional.of(elves), 75001, Optional.empty()),
                database.lookupMany(Set.of(75000, 75001)));
    }

    @Test
    void lookup_missesEverythingWithoutIndex() {
        ScryfallIndexCardDatabase database = database(dir.resolve("missing.json"));

        assertTrue(database.lookup(75000).isEmpty());
        assertEquals(0, database.size());
    }

    @Test
    void lookup_missesEverythingWhenIndexIsCorrupt() throws IOException {
        Path index = Files.writeString(dir.resolve("arena_id_index.json"), "{\"75000\": [", StandardCharsets.UTF_8);

        assertTrue(database(index).lookup(75000).isEmpty());
    }

    private static ScryfallIndexCardDatabase database(Path index) {
        ArenaStatsProperties properties = new ArenaStatsProperties();
        properties.getCards().setIndexPath(index.toString());
        return new ScryfallIndexCardDatabase(properties, new ObjectMapper());
    }
}
