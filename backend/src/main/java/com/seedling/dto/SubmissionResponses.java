package com.seedling.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.seedling.model.PaymentStatus;
import com.seedling.model.SubmissionStatus;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public final class SubmissionResponses {

    private SubmissionResponses() {
    }

    public record SubmissionDetail(
            UUID submissionId,
            UUID competitionId,
            UUID userId,
            String title,
            String description,
            SubmissionStatus status,
            JsonNode attachments,
            BigDecimal finalScore,
            String placement,
            OffsetDateTime submittedAt,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt,
            String paymentClientSecret
    ) {
    }

    public record PaymentStatusCheck(
            UUID submissionId,
            SubmissionStatus submissionStatus,
            PaymentStatus paymentStatus,
            String processorStatus,
            String message
    ) {
    }
}
