package com.seedling.dto;

import com.seedling.model.PaymentStatus;
import com.seedling.model.PaymentType;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public final class SettlementResponses {

    private SettlementResponses() {
    }

    public record JudgeAssignmentView(
            UUID assignmentId,
            UUID competitionId,
            UUID submissionId,
            UUID judgeId,
            String judgeUsername,
            UUID assignedBy,
            OffsetDateTime assignedAt,
            OffsetDateTime completedAt
    ) {
    }

    public record SelectedWinner(
            UUID submissionId,
            String title,
            UUID userId,
            String place,
            BigDecimal prizeAmount
    ) {
    }

    public record WinnerSelectionResult(
            UUID competitionId,
            List<SelectedWinner> winners,
            int notSelectedCount
    ) {
    }

    public record PayoutOutcome(
            UUID submissionId,
            UUID userId,
            String username,
            String place,
            BigDecimal amount,
            String outcome,
            String transferId,
            UUID paymentId,
            String message
    ) {
    }

    public record PrizeDistributionResult(
            UUID competitionId,
            List<PayoutOutcome> successful,
            List<PayoutOutcome> pendingBankInfo,
            List<PayoutOutcome> failed,
            List<PayoutOutcome> alreadyPaid,
            BigDecimal totalDistributed,
            BigDecimal totalExpected,
            String summary
    ) {
    }

    public record PaymentView(
            UUID paymentId,
            UUID userId,
            UUID competitionId,
            UUID submissionId,
            PaymentType type,
            PaymentStatus status,
            BigDecimal amount,
            String processorChargeId,
            String processorTransferId,
            String failureReason,
            OffsetDateTime processedAt,
            OffsetDateTime createdAt
    ) {
    }

    public record WinningView(
            UUID paymentId,
            BigDecimal amount,
            PaymentStatus status,
            String transferId,
            OffsetDateTime createdAt,
            OffsetDateTime processedAt,
            UUID competitionId,
            String competitionTitle,
            UUID submissionId,
            String submissionTitle,
            String placement
    ) {
    }

    public record WebhookAck(
            String status,
            String message
    ) {
        public static WebhookAck success() {
            return new WebhookAck("success", null);
        }

        public static WebhookAck error(String message) {
            return new WebhookAck("error", message);
        }
    }
}
