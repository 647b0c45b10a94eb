package com.arenastats.repository;

import com.arenastats.model.Card;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Set;

@Repository
public interface CardRepository extends JpaRepository<Card, Integer> {
    List<Card> findByGrpIdIn(Collection<Integer> grpIds);

    @Query("select c.grpId from Card c where c.grpId in :grpIds")
    Set<Integer> findExistingGrpIds(@Param("grpIds") Collection<Integer> grpIds);
}
