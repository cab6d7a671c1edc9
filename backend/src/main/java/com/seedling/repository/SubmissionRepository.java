package com.seedling.repository;

import com.seedling.model.Submission;
import com.seedling.model.SubmissionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface SubmissionRepository extends JpaRepository<Submission, UUID> {

    List<Submission> findByCompetitionIdAndStatusIn(UUID competitionId, Collection<SubmissionStatus> statuses);

    List<Submission> findByCompetitionIdAndUserIdAndStatusIn(
            UUID competitionId,
            UUID userId,
            Collection<SubmissionStatus> statuses
    );

    long countByCompetitionId(UUID competitionId);

    long countByCompetitionIdAndStatus(UUID competitionId, SubmissionStatus status);

    List<Submission> findBySubmissionIdIn(Collection<UUID> submissionIds);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select s from Submission s where s.submissionId = :submissionId")
    Optional<Submission> findBySubmissionIdForUpdate(@Param("submissionId") UUID submissionId);
}
