package com.arenastats.cards;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Card definition as held by the card database, keyed by Arena id.
 * Double-faced cards carry their front face's cost, type line, text and stats.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CardFacts(
        @JsonProperty("name") String name,
        @JsonProperty("mana_cost") String manaCost,
        @JsonProperty("cmc") Double cmc,
        @JsonProperty("type_line") String typeLine,
        @JsonProperty("colors") List<String> colors,
        @JsonProperty("color_identity") List<String> colorIdentity,
        @JsonProperty("set_code") String setCode,
        @JsonProperty("rarity") String rarity,
        @JsonProperty("oracle_text") String oracleText,
        @JsonProperty("power") String power,
        @JsonProperty("toughness") String toughness,
        @JsonProperty("scryfall_id") String scryfallId,
        @JsonProperty("image_uri") String imageUri
) {

    public CardFacts {
        colors = colors == null ? List.of() : List.copyOf(colors);
        colorIdentity = colorIdentity == null ? List.of() : List.copyOf(colorIdentity);
    }

    public static CardFacts named(String name) {
        return new CardFacts(name, null, null, null, null, null, null, null, null, null, null, null, null);
    }
}
