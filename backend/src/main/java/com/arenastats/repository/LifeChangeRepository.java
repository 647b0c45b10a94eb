package com.arenastats.repository;

import com.arenastats.model.LifeChange;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LifeChangeRepository extends JpaRepository<LifeChange, Long> {
    List<LifeChange> findByMatchIdOrderByIdAsc(Long matchId);
}
