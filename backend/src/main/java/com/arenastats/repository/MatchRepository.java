package com.arenastats.repository;

import com.arenastats.model.Match;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.Set;

@Repository
public interface MatchRepository extends JpaRepository<Match, Long> {
    Optional<Match> findByMatchId(String matchId);

    @Query("select m.matchId from Match m")
    Set<String> findAllMatchIds();

    /**
     * Deletes a match. Child rows go with it through the schema's cascading foreign keys.
     */
    @Modifying
    @Query("delete from Match m where m.matchId = :matchId")
    int deleteByMatchId(@Param("matchId") String matchId);
}
