package com.arenastats.model;

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

@Getter
@Setter
@Entity
@Table(name = "life_changes")
public class LifeChange {

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

    @Column(name = "seat_id", nullable = false)
    private Integer seatId;

    @Column(name = "life_total", nullable = false)
    private Integer lifeTotal;

    @Column(name = "change_amount")
    private Integer changeAmount;
}
