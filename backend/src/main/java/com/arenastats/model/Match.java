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

import java.time.OffsetDateTime;

/**
 * One imported match. {@code matchId} is the client's identifier and is unique.
 */
@Getter
@Setter
@Entity
@Table(name = "matches")
public class Match {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "match_id", nullable = false, unique = true, length = 64)
    private String matchId;

    @Column(name = "game_number", nullable = false)
    private Integer gameNumber = 1;

    @Column(name = "player_seat_id")
    private Integer playerSeatId;

    @Column(name = "player_name")
    private String playerName;

    @Column(name = "player_user_id", length = 64)
    private String playerUserId;

    @Column(name = "opponent_seat_id")
    private Integer opponentSeatId;

    @Column(name = "opponent_name")
    private String opponentName;

    @Column(name = "opponent_user_id", length = 64)
    private String opponentUserId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "deck_id")
    private Deck deck;

    @Column(name = "event_id", length = 128)
    private String eventId;

    @Column(name = "format", length = 64)
    private String format;

    @Column(name = "match_type", length = 64)
    private String matchType;

    /**
     * {@code win}, {@code loss}, or null while the outcome is unknown.
     */
    @Column(name = "result", length = 16)
    private String result;

    @Column(name = "winning_team_id")
    private Integer winningTeamId;

    @Column(name = "winning_reason", length = 128)
    private String winningReason;

    @Column(name = "start_time")
    private OffsetDateTime startTime;

    @Column(name = "end_time")
    private OffsetDateTime endTime;

    @Column(name = "duration_seconds")
    private Integer durationSeconds;

    @Column(name = "total_turns", nullable = false)
    private Integer totalTurns = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();
}
