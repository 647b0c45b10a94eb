package com.arenastats.repository;

import com.arenastats.model.ZoneTransfer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ZoneTransferRepository extends JpaRepository<ZoneTransfer, Long> {
    List<ZoneTransfer> findByMatchIdOrderByIdAsc(Long matchId);
}
