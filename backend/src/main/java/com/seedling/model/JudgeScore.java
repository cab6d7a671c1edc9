package com.seedling.model;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;

public record JudgeScore(
        UUID judgeId,
        String judgeName,
        Map<String, Double> criteriaScores,
        double overall,
        String feedback,
        OffsetDateTime submittedAt
) {
}
