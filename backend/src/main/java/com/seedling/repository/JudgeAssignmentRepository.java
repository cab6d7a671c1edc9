package com.seedling.repository;

import com.seedling.model.JudgeAssignment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface JudgeAssignmentRepository extends JpaRepository<JudgeAssignment, UUID> {

    Optional<JudgeAssignment> findByJudgeIdAndSubmissionId(UUID judgeId, UUID submissionId);

    boolean existsByJudgeIdAndSubmissionId(UUID judgeId, UUID submissionId);

    List<JudgeAssignment> findByCompetitionIdOrderByAssignedAtAsc(UUID competitionId);

    List<JudgeAssignment> findBySubmissionIdIn(Collection<UUID> submissionIds);

    List<JudgeAssignment> findByJudgeIdOrderByAssignedAtAsc(UUID judgeId);

    List<JudgeAssignment> findByJudgeIdAndCompetitionId(UUID judgeId, UUID competitionId);

    @Modifying
    @Query("delete from JudgeAssignment a where a.competitionId = :competitionId")
    int deleteByCompetitionId(@Param("competitionId") UUID competitionId);
}
