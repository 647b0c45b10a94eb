package com.arenastats.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Getter
@Setter
@Entity
@Table(name = "game_actions")
public class GameAction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "match_id", nullable = false)
    private Match match;

    @Column(name = "game_state_id")
    private Integer gameStateId;

    @Column(name = "turn_number")
    private Integer turnNumber;

    @Column(name = "phase", length = 64)
    private String phase;

    @Column(name = "step", length = 64)
    private String step;

    @Column(name = "active_player_seat")
    private Integer activePlayerSeat;

    @Column(name = "seat_id")
    private Integer seatId;

    @Column(name = "action_type", nullable = false, length = 64)
    private String actionType;

    @Column(name = "instance_id")
    private Integer instanceId;

    @Column(name = "card_grp_id")
    private Integer cardGrpId;

    @Column(name = "ability_grp_id")
    private Integer abilityGrpId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "mana_cost", columnDefinition = "jsonb")
    private JsonNode manaCost;

    @Column(name = "timestamp_ms")
    private Long timestampMs;
}
