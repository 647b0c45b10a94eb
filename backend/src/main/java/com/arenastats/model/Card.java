package com.arenastats.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Card definition cache, keyed by Arena id. Also holds locally named tokens and card faces.
 */
@Getter
@Setter
@Entity
@Table(name = "cards")
public class Card {

    @Id
    @Column(name = "grp_id", nullable = false, updatable = false)
    private Integer grpId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "mana_cost", length = 128)
    private String manaCost;

    @Column(name = "cmc")
    private Double cmc;

    @Column(name = "type_line")
    private String typeLine;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "colors", nullable = false, columnDefinition = "jsonb")
    private List<String> colors = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "color_identity", nullable = false, columnDefinition = "jsonb")
    private List<String> colorIdentity = new ArrayList<>();

    @Column(name = "set_code", length = 16)
    private String setCode;

    @Column(name = "rarity", length = 32)
    private String rarity;

    @Column(name = "oracle_text", columnDefinition = "TEXT")
    private String oracleText;

    @Column(name = "power", length = 16)
    private String power;

    @Column(name = "toughness", length = 16)
    private String toughness;

    @Column(name = "scryfall_id", length = 64)
    private String scryfallId;

    @Column(name = "image_uri", length = 512)
    private String imageUri;

    @Column(name = "is_token", nullable = false)
    private Boolean isToken = false;

    @Column(name = "object_type", length = 64)
    private String objectType;

    /**
     * Card the name was derived from, for Omen back faces named after their front face.
     */
    @Column(name = "source_grp_id")
    private Integer sourceGrpId;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
