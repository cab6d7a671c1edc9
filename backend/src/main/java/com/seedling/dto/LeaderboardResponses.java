package com.seedling.dto;

import com.seedling.model.CompetitionStatus;
import com.seedling.model.SubmissionStatus;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class LeaderboardResponses {

    private LeaderboardResponses() {
    }

    public record LeaderboardEntry(
            int rank,
            UUID submissionId,
            String title,
            UUID userId,
            String username,
            SubmissionStatus status,
            String placement,
            BigDecimal finalScore,
            double humanAverage,
            int judgesAssigned,
            int judgesCompleted,
            boolean judgingComplete,
            boolean hasTie
    ) {
    }

    public record Leaderboard(
            UUID competitionId,
            String competitionTitle,
            CompetitionStatus competitionStatus,
            BigDecimal prizePool,
            Map<String, Double> prizeStructure,
            List<LeaderboardEntry> entries,
            long totalSubmissions,
            int eligibleSubmissions,
            int fullyJudgedCount
    ) {
    }

    public record PublicResultEntry(
            int rank,
            UUID submissionId,
            String title,
            String username,
            String placement,
            BigDecimal finalScore,
            boolean hasTie
    ) {
    }

    public record PublicResults(
            UUID competitionId,
            String competitionTitle,
            BigDecimal prizePool,
            List<PublicResultEntry> entries
    ) {
    }
}
