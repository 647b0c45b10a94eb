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
@Table(name = "zone_transfers")
public class ZoneTransfer {

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

    @Column(name = "instance_id")
    private Integer instanceId;

    /**
     * Null when the object was never identified or its id is not in the card table.
     */
    @Column(name = "card_grp_id")
    private Integer cardGrpId;

    @Column(name = "from_zone")
    private Integer fromZone;

    @Column(name = "to_zone")
    private Integer toZone;

    @Column(name = "category", length = 64)
    private String category;
}
