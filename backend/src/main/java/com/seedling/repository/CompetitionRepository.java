package com.seedling.repository;

import com.seedling.model.Competition;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CompetitionRepository extends JpaRepository<Competition, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from Competition c where c.competitionId = :competitionId")
    Optional<Competition> findByCompetitionIdForUpdate(@Param("competitionId") UUID competitionId);
}
