package com.seedling.model;

import java.time.OffsetDateTime;
import java.util.UUID;

public record JudgeFeedback(
        UUID judgeId,
        String judgeName,
        String feedback,
        OffsetDateTime submittedAt
) {
}
