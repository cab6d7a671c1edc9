package com.seedling.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.seedling.model.CompetitionStatus;
import com.seedling.model.SubmissionStatus;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class JudgingResponses {

    private JudgingResponses() {
    }

    public record JudgeScoreView(
            UUID judgeId,
            String judgeName,
            Map<String, Double> criteriaScores,
            double overall,
            String feedback,
            OffsetDateTime submittedAt
    ) {
    }

    public record ScoredSubmission(
            UUID submissionId,
            UUID competitionId,
            String title,
            String description,
            SubmissionStatus status,
            JsonNode attachments,
            BigDecimal finalScore,
            double humanAverage,
            int judgesScored,
            JudgeScoreView myScore
    ) {
    }

    public record AssignedSubmission(
            UUID assignmentId,
            UUID submissionId,
            String title,
            SubmissionStatus status,
            OffsetDateTime assignedAt,
            OffsetDateTime completedAt
    ) {
    }

    public record AssignmentSummary(
            UUID competitionId,
            String competitionTitle,
            CompetitionStatus competitionStatus,
            JsonNode rubric,
            int totalAssigned,
            int completed,
            List<AssignedSubmission> submissions
    ) {
    }
}
