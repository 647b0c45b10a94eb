package com.arenastats.repository;

import com.arenastats.model.UnknownCard;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UnknownCardRepository extends JpaRepository<UnknownCard, Long> {
}
