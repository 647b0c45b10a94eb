package com.arenastats.repository;

import com.arenastats.model.GameAction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface GameActionRepository extends JpaRepository<GameAction, Long> {
    List<GameAction> findByMatchIdOrderByIdAsc(Long matchId);
}
