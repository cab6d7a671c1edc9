package com.seedling.service;

import com.seedling.config.SettlementProperties;
import com.seedling.dto.SubmissionResponses;
import com.seedling.model.Competition;
import com.seedling.model.CompetitionStatus;
import com.seedling.model.Payment;
import com.seedling.model.PaymentStatus;
import com.seedling.model.PaymentType;
import com.seedling.model.Submission;
import com.seedling.model.SubmissionStatus;
import com.seedling.provider.ChargeHandle;
import com.seedling.provider.ChargeStatus;
import com.seedling.provider.PaymentProcessorClient;
import com.seedling.provider.PaymentProcessorException;
import com.seedling.repository.CompetitionRepository;
import com.seedling.repository.PaymentRepository;
import com.seedling.repository.SubmissionRepository;
import com.seedling.web.SettlementException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry-fee half of the settlement reconciler. Every path that completes or fails an
 * ENTRY_FEE payment (webhook, client poll, sweep) goes through this service.
 */
@Service
@RequiredArgsConstructor
public class EntryFeeSettlementService {

    private static final Logger log = LoggerFactory.getLogger(EntryFeeSettlementService.class);

    private final PaymentRepository paymentRepository;
    private final SubmissionRepository submissionRepository;
    private final CompetitionRepository competitionRepository;
    private final PaymentProcessorClient paymentProcessorClient;
    private final SettlementProperties settlementProperties;

    /**
     * Starts or resumes the entry-fee charge of a submission. At most one PENDING entry-fee
     * payment exists per submission; an existing charge is inspected before a new one is made.
     */
    @Transactional
    public EntryRequestOutcome requestEntry(Submission submission, Competition competition) {
        if (competition.getStatus() != CompetitionStatus.ACTIVE) {
            throw SettlementException.preconditionFailed(
                    "Competition is not active. Current status: " + competition.getStatus()
            );
        }
        if (competition.getCurrentEntries() >= competition.getMaxEntries()) {
            throw SettlementException.preconditionFailed(
                    "Competition is full",
                    Map.of("currentEntries", competition.getCurrentEntries(), "maxEntries", competition.getMaxEntries())
            );
        }

        Optional<Payment> pending = paymentRepository.findFirstBySubmissionIdAndTypeAndStatus(
                submission.getSubmissionId(),
                PaymentType.ENTRY_FEE,
                PaymentStatus.PENDING
        );
        if (pending.isPresent() && pending.get().getProcessorChargeId() != null) {
            Payment existing = pending.get();
            ChargeHandle charge;
            try {
                charge = paymentProcessorClient.getCharge(existing.getProcessorChargeId());
            } catch (PaymentProcessorException ex) {
                throw SettlementException.externalServiceError(
                        "Failed to retrieve existing payment intent: " + ex.getMessage(),
                        ex
                );
            }

            if (charge.status() == ChargeStatus.SUCCEEDED) {
                confirmEntryFee(existing.getPaymentId());
                log.info(
                        "Existing entry-fee charge already succeeded: submissionId={}, chargeId={}",
                        submission.getSubmissionId(),
                        charge.id()
                );
                return new EntryRequestOutcome(existing.getPaymentId(), SubmissionStatus.SUBMITTED, null, true);
            }
            if (!charge.status().isReplaceable()) {
                return new EntryRequestOutcome(
                        existing.getPaymentId(),
                        SubmissionStatus.PENDING_PAYMENT,
                        charge.clientSecret(),
                        true
                );
            }

            supersede(existing, "Superseded by a new charge; previous status: " + charge.status().wireValue());
            log.info(
                    "Replacing entry-fee charge: submissionId={}, previousChargeId={}, previousStatus={}",
                    submission.getSubmissionId(),
                    existing.getProcessorChargeId(),
                    charge.status()
            );
        } else if (pending.isPresent()) {
            supersede(pending.get(), "No processor charge recorded");
        }

        if (competition.getEntryFee().signum() == 0) {
            Payment free = newEntryFeePayment(submission, BigDecimal.ZERO.setScale(2));
            Payment saved = savePending(free);
            confirmEntryFee(saved.getPaymentId());
            log.info("Free entry accepted: submissionId={}, competitionId={}", submission.getSubmissionId(), competition.getCompetitionId());
            return new EntryRequestOutcome(saved.getPaymentId(), SubmissionStatus.SUBMITTED, null, false);
        }

        return createCharge(submission, competition);
    }

    /**
     * Applies the success effects of a paid entry fee. Only a PENDING payment can complete;
     * replays on a COMPLETED payment change nothing. Locks are taken in the order submission,
     * payment, competition on every settlement path.
     *
     * @return {@code true} if this call completed the payment
     */
    @Transactional
    public boolean confirmEntryFee(UUID paymentId) {
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> SettlementException.notFound("Payment not found: " + paymentId));
        if (payment.getType() != PaymentType.ENTRY_FEE) {
            throw SettlementException.validationFailed("Payment " + paymentId + " is not an entry fee");
        }
        UUID submissionId = payment.getSubmissionId();
        UUID competitionId = payment.getCompetitionId();
        BigDecimal amount = payment.getAmount();

        lockSubmission(submissionId);
        OffsetDateTime now = OffsetDateTime.now();
        if (paymentRepository.completeIfPending(paymentId, PaymentStatus.PENDING, PaymentStatus.COMPLETED, now) == 0) {
            PaymentStatus current = paymentRepository.findById(paymentId).map(Payment::getStatus).orElse(null);
            if (current == PaymentStatus.FAILED) {
                log.warn(
                        "Charge succeeded for an entry fee already marked failed; not credited: paymentId={}, submissionId={}",
                        paymentId,
                        submissionId
                );
            } else {
                log.info("Entry fee already confirmed: paymentId={}, status={}", paymentId, current);
            }
            return false;
        }

        Competition competition = competitionRepository.findByCompetitionIdForUpdate(competitionId)
                .orElseThrow(() -> SettlementException.notFound("Competition not found: " + competitionId));
        Submission submission = submissionRepository.findById(submissionId)
                .orElseThrow(() -> SettlementException.notFound("Submission not found: " + submissionId));

        if (!submission.getStatus().isOwnerEditable()) {
            log.warn(
                    "Entry fee paid for a submission that is already entered: paymentId={}, submissionId={}, status={}",
                    paymentId,
                    submissionId,
                    submission.getStatus()
            );
            return true;
        }

        submission.setStatus(SubmissionStatus.SUBMITTED);
        if (submission.getSubmittedAt() == null) {
            submission.setSubmittedAt(now);
        }
        submission.setUpdatedAt(now);
        submissionRepository.save(submission);

        BigDecimal credited = MoneyAmounts.netEntryFee(amount, competition.getPlatformFeePercentage());
        competition.setCurrentEntries(competition.getCurrentEntries() + 1);
        competition.setPrizePool(MoneyAmounts.scale(competition.getPrizePool().add(credited)));
        competition.setUpdatedAt(now);
        competitionRepository.save(competition);

        log.info(
                "Entry fee confirmed: paymentId={}, submissionId={}, competitionId={}, credited={}, prizePool={}",
                paymentId,
                submissionId,
                competitionId,
                credited,
                competition.getPrizePool()
        );
        return true;
    }

    @Transactional
    public boolean confirmEntryFeeByCharge(String chargeId) {
        Optional<Payment> payment = paymentRepository.findByProcessorChargeId(chargeId);
        if (payment.isEmpty()) {
            log.warn("No payment recorded for charge: chargeId={}", chargeId);
            return false;
        }
        return confirmEntryFee(payment.get().getPaymentId());
    }

    /**
     * Moves a PENDING entry-fee payment to FAILED. Terminal payments are left untouched.
     */
    @Transactional
    public boolean failEntryFee(UUID paymentId, String reason) {
        Payment payment = paymentRepository.findById(paymentId)
                .orElseThrow(() -> SettlementException.notFound("Payment not found: " + paymentId));
        lockSubmission(payment.getSubmissionId());
        if (paymentRepository.failIfPending(paymentId, PaymentStatus.PENDING, PaymentStatus.FAILED, reason, OffsetDateTime.now()) == 0) {
            log.info("Ignoring failure for settled payment: paymentId={}", paymentId);
            return false;
        }
        log.info("Entry fee failed: paymentId={}, reason={}", paymentId, reason);
        return true;
    }

    @Transactional
    public boolean failEntryFeeByCharge(String chargeId, String reason) {
        Optional<Payment> payment = paymentRepository.findByProcessorChargeId(chargeId);
        if (payment.isEmpty()) {
            log.warn("No payment recorded for failed charge: chargeId={}", chargeId);
            return false;
        }
        return failEntryFee(payment.get().getPaymentId(), reason);
    }

    /**
     * Client-initiated status check of a submission's pending entry fee.
     */
    @Transactional
    public SubmissionResponses.PaymentStatusCheck pollEntryFee(Submission submission) {
        if (submission.getStatus() != SubmissionStatus.PENDING_PAYMENT) {
            throw SettlementException.preconditionFailed(
                    "Cannot check payment status. Submission status is: " + submission.getStatus()
            );
        }
        Payment payment = paymentRepository.findFirstBySubmissionIdAndTypeOrderByCreatedAtDesc(
                        submission.getSubmissionId(),
                        PaymentType.ENTRY_FEE
                )
                .orElseThrow(() -> SettlementException.notFound(
                        "No entry-fee payment found for submission " + submission.getSubmissionId()
                ));
        if (payment.getProcessorChargeId() == null) {
            throw SettlementException.preconditionFailed("Payment has no processor charge");
        }

        ChargeHandle charge;
        try {
            charge = paymentProcessorClient.getCharge(payment.getProcessorChargeId());
        } catch (PaymentProcessorException ex) {
            throw SettlementException.externalServiceError("Failed to retrieve payment status: " + ex.getMessage(), ex);
        }

        String message;
        switch (charge.status()) {
            case SUCCEEDED -> {
                confirmEntryFee(payment.getPaymentId());
                message = "Payment confirmed! Your submission is complete.";
            }
            case REQUIRES_PAYMENT_METHOD ->
                    message = "Payment not yet completed. Please complete payment on the payment page.";
            case PROCESSING -> message = "Payment is being processed. Please check again in a few moments.";
            case REQUIRES_ACTION, REQUIRES_CONFIRMATION ->
                    message = "Payment requires additional action. Please complete payment on the payment page.";
            case CANCELED -> {
                failEntryFee(payment.getPaymentId(), "Charge canceled");
                message = "Payment was canceled. Please create a new payment.";
            }
            default -> message = "Payment status: " + charge.status().wireValue()
                    + ". Please contact support if this persists.";
        }

        Submission refreshed = submissionRepository.findById(submission.getSubmissionId()).orElse(submission);
        Payment refreshedPayment = paymentRepository.findById(payment.getPaymentId()).orElse(payment);
        return new SubmissionResponses.PaymentStatusCheck(
                refreshed.getSubmissionId(),
                refreshed.getStatus(),
                refreshedPayment.getStatus(),
                charge.status().wireValue(),
                message
        );
    }

    private EntryRequestOutcome createCharge(Submission submission, Competition competition) {
        BigDecimal amount = MoneyAmounts.scale(competition.getEntryFee());
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("user_id", submission.getUserId().toString());
        metadata.put("competition_id", competition.getCompetitionId().toString());
        metadata.put("submission_id", submission.getSubmissionId().toString());
        metadata.put("type", "entry_fee");

        ChargeHandle charge;
        try {
            charge = paymentProcessorClient.createCharge(
                    MoneyAmounts.toMinorUnits(amount),
                    settlementProperties.getCurrency(),
                    metadata
            );
        } catch (PaymentProcessorException ex) {
            throw SettlementException.externalServiceError("Payment processing error: " + ex.getMessage(), ex);
        }

        Payment payment = newEntryFeePayment(submission, amount);
        payment.setProcessorChargeId(charge.id());
        Payment saved = savePending(payment);

        submission.setStatus(SubmissionStatus.PENDING_PAYMENT);
        submission.setUpdatedAt(OffsetDateTime.now());
        submissionRepository.save(submission);

        log.info(
                "Entry-fee charge created: submissionId={}, paymentId={}, chargeId={}, amount={}",
                submission.getSubmissionId(),
                saved.getPaymentId(),
                charge.id(),
                amount
        );
        return new EntryRequestOutcome(saved.getPaymentId(), SubmissionStatus.PENDING_PAYMENT, charge.clientSecret(), false);
    }

    private void lockSubmission(UUID submissionId) {
        if (submissionId == null) {
            throw SettlementException.validationFailed("Entry-fee payment has no submission");
        }
        submissionRepository.findBySubmissionIdForUpdate(submissionId)
                .orElseThrow(() -> SettlementException.notFound("Submission not found: " + submissionId));
    }

    private void supersede(Payment payment, String reason) {
        lockSubmission(payment.getSubmissionId());
        if (paymentRepository.failIfPending(
                payment.getPaymentId(),
                PaymentStatus.PENDING,
                PaymentStatus.FAILED,
                reason,
                OffsetDateTime.now()
        ) == 0) {
            throw SettlementException.conflict(
                    "The entry-fee payment for submission " + payment.getSubmissionId() + " was settled concurrently"
            );
        }
    }

    private Payment newEntryFeePayment(Submission submission, BigDecimal amount) {
        Payment payment = new Payment();
        payment.setPaymentId(UUID.randomUUID());
        payment.setUserId(submission.getUserId());
        payment.setCompetitionId(submission.getCompetitionId());
        payment.setSubmissionId(submission.getSubmissionId());
        payment.setType(PaymentType.ENTRY_FEE);
        payment.setStatus(PaymentStatus.PENDING);
        payment.setAmount(amount);
        return payment;
    }

    private Payment savePending(Payment payment) {
        try {
            return paymentRepository.saveAndFlush(payment);
        } catch (DataIntegrityViolationException ex) {
            throw SettlementException.conflict(
                    "An entry-fee payment is already in progress for submission " + payment.getSubmissionId()
            );
        }
    }

    public record EntryRequestOutcome(
            UUID paymentId,
            SubmissionStatus submissionStatus,
            String clientSecret,
            boolean reusedCharge
    ) {
    }
}
