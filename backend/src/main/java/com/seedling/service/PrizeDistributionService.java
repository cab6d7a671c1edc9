package com.seedling.service;

import com.seedling.config.SettlementProperties;
import com.seedling.dto.SettlementResponses;
import com.seedling.mapper.SeedlingResponseMapper;
import com.seedling.model.Competition;
import com.seedling.model.CompetitionStatus;
import com.seedling.model.CompetitionTermsJsonCodec;
import com.seedling.model.Payment;
import com.seedling.model.PaymentStatus;
import com.seedling.model.PaymentType;
import com.seedling.model.Submission;
import com.seedling.model.SubmissionStatus;
import com.seedling.model.User;
import com.seedling.provider.PaymentProcessorClient;
import com.seedling.provider.PaymentProcessorException;
import com.seedling.provider.ProcessorBalance;
import com.seedling.provider.TransferHandle;
import com.seedling.repository.CompetitionRepository;
import com.seedling.repository.PaymentRepository;
import com.seedling.repository.SubmissionRepository;
import com.seedling.repository.UserRepository;
import com.seedling.web.SettlementException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Prize half of the settlement reconciler. Transfers are keyed per (competition, submission)
 * so a repeated distribution resolves to the same processor transfer.
 */
@Service
@RequiredArgsConstructor
public class PrizeDistributionService {

    private static final Logger log = LoggerFactory.getLogger(PrizeDistributionService.class);
    private static final Set<PaymentStatus> SETTLED_OR_IN_FLIGHT = EnumSet.of(PaymentStatus.PENDING, PaymentStatus.COMPLETED);

    static final String OUTCOME_SUCCESS = "success";
    static final String OUTCOME_PENDING_ACCOUNT = "pending_connect_account";
    static final String OUTCOME_PENDING_ONBOARDING = "pending_connect_onboarding";
    static final String OUTCOME_ALREADY_PAID = "already_paid";
    static final String OUTCOME_ERROR = "error";

    private final CompetitionRepository competitionRepository;
    private final SubmissionRepository submissionRepository;
    private final PaymentRepository paymentRepository;
    private final UserRepository userRepository;
    private final PaymentProcessorClient paymentProcessorClient;
    private final SettlementProperties settlementProperties;
    private final ActorAccessService actorAccessService;
    private final SeedlingResponseMapper seedlingResponseMapper;

    @Transactional
    public SettlementResponses.PrizeDistributionResult distributePrizes(UUID competitionId, UUID actorId) {
        User admin = actorAccessService.requireAdmin(actorId);
        Competition competition = competitionRepository.findByCompetitionIdForUpdate(competitionId)
                .orElseThrow(() -> SettlementException.notFound("Competition not found: " + competitionId));
        if (competition.getStatus() != CompetitionStatus.COMPLETE) {
            throw SettlementException.preconditionFailed(
                    "Competition must be COMPLETE to distribute prizes. Current status: " + competition.getStatus(),
                    Map.of("currentStatus", competition.getStatus(), "requiredStatus", CompetitionStatus.COMPLETE)
            );
        }

        List<Submission> winners = submissionRepository.findByCompetitionIdAndStatusIn(
                competitionId,
                EnumSet.of(SubmissionStatus.WINNER)
        );
        if (winners.isEmpty()) {
            throw SettlementException.preconditionFailed("No winners selected for this competition");
        }

        Map<String, Double> prizeStructure = CompetitionTermsJsonCodec.prizeStructure(competition.getPrizeStructure());
        Map<UUID, User> users = userRepository.findAllById(winners.stream().map(Submission::getUserId).toList()).stream()
                .collect(Collectors.toMap(User::getUserId, Function.identity()));

        List<PlannedPayout> plan = new ArrayList<>(winners.size());
        for (Submission winner : winners) {
            double fraction = prizeStructure.getOrDefault(winner.getPlacement(), 0.0);
            plan.add(new PlannedPayout(
                    winner,
                    users.get(winner.getUserId()),
                    MoneyAmounts.prizeFor(competition.getPrizePool(), fraction)
            ));
        }

        verifyBalanceCovers(competitionId, plan);

        List<SettlementResponses.PayoutOutcome> successful = new ArrayList<>();
        List<SettlementResponses.PayoutOutcome> pendingBankInfo = new ArrayList<>();
        List<SettlementResponses.PayoutOutcome> failed = new ArrayList<>();
        List<SettlementResponses.PayoutOutcome> alreadyPaid = new ArrayList<>();
        BigDecimal totalDistributed = MoneyAmounts.scale(BigDecimal.ZERO);
        BigDecimal totalExpected = MoneyAmounts.scale(BigDecimal.ZERO);

        for (PlannedPayout payout : plan) {
            totalExpected = totalExpected.add(payout.amount());
            SettlementResponses.PayoutOutcome outcome = payOne(competition, payout);
            switch (outcome.outcome()) {
                case OUTCOME_SUCCESS -> {
                    successful.add(outcome);
                    totalDistributed = totalDistributed.add(outcome.amount());
                }
                case OUTCOME_PENDING_ACCOUNT, OUTCOME_PENDING_ONBOARDING -> pendingBankInfo.add(outcome);
                case OUTCOME_ALREADY_PAID -> alreadyPaid.add(outcome);
                default -> failed.add(outcome);
            }
        }

        String summary = String.format(
                "%d successful, %d pending bank info, %d failed, %d already paid",
                successful.size(),
                pendingBankInfo.size(),
                failed.size(),
                alreadyPaid.size()
        );
        log.info("Prize distribution finished: competitionId={}, adminId={}, {}", competitionId, admin.getUserId(), summary);
        return new SettlementResponses.PrizeDistributionResult(
                competitionId,
                successful,
                pendingBankInfo,
                failed,
                alreadyPaid,
                totalDistributed,
                totalExpected,
                summary
        );
    }

    @Transactional
    public boolean markTransferPaid(String transferId) {
        Payment payment = paymentRepository.findByProcessorTransferId(transferId).orElse(null);
        if (payment == null) {
            log.warn("No payout recorded for transfer: transferId={}", transferId);
            return false;
        }
        UUID paymentId = payment.getPaymentId();
        if (paymentRepository.completeIfPending(paymentId, PaymentStatus.PENDING, PaymentStatus.COMPLETED, OffsetDateTime.now()) == 0) {
            log.info("Ignoring paid event for settled payout: transferId={}, status={}", transferId, currentStatus(paymentId));
            return false;
        }
        log.info("Prize payout completed: paymentId={}, transferId={}", paymentId, transferId);
        return true;
    }

    @Transactional
    public boolean markTransferFailed(String transferId, String reason) {
        Payment payment = paymentRepository.findByProcessorTransferId(transferId).orElse(null);
        if (payment == null) {
            log.warn("No payout recorded for failed transfer: transferId={}", transferId);
            return false;
        }
        UUID paymentId = payment.getPaymentId();
        if (paymentRepository.failIfPending(paymentId, PaymentStatus.PENDING, PaymentStatus.FAILED, reason, OffsetDateTime.now()) == 0) {
            log.info("Ignoring failed event for settled payout: transferId={}, status={}", transferId, currentStatus(paymentId));
            return false;
        }
        log.warn("Prize payout failed: paymentId={}, transferId={}, reason={}", paymentId, transferId, reason);
        return true;
    }

    private PaymentStatus currentStatus(UUID paymentId) {
        return paymentRepository.findById(paymentId).map(Payment::getStatus).orElse(null);
    }

    @Transactional(readOnly = true)
    public List<SettlementResponses.PaymentView> listCompetitionPayouts(UUID competitionId, UUID actorId) {
        actorAccessService.requireAdmin(actorId);
        if (!competitionRepository.existsById(competitionId)) {
            throw SettlementException.notFound("Competition not found: " + competitionId);
        }
        return paymentRepository.findByCompetitionIdAndTypeOrderByCreatedAtAsc(competitionId, PaymentType.PRIZE_PAYOUT).stream()
                .map(seedlingResponseMapper::toPaymentView)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<SettlementResponses.WinningView> myWinnings(UUID actorId) {
        User actor = actorAccessService.requireUser(actorId);
        List<Payment> payouts = paymentRepository.findByUserIdAndTypeOrderByCreatedAtDesc(actor.getUserId(), PaymentType.PRIZE_PAYOUT);
        Map<UUID, Competition> competitions = competitionRepository
                .findAllById(payouts.stream().map(Payment::getCompetitionId).collect(Collectors.toSet())).stream()
                .collect(Collectors.toMap(Competition::getCompetitionId, Function.identity()));
        Map<UUID, Submission> submissions = submissionRepository
                .findBySubmissionIdIn(payouts.stream().map(Payment::getSubmissionId).collect(Collectors.toSet())).stream()
                .collect(Collectors.toMap(Submission::getSubmissionId, Function.identity()));

        List<SettlementResponses.WinningView> winnings = new ArrayList<>(payouts.size());
        for (Payment payout : payouts) {
            Competition competition = competitions.get(payout.getCompetitionId());
            Submission submission = submissions.get(payout.getSubmissionId());
            winnings.add(new SettlementResponses.WinningView(
                    payout.getPaymentId(),
                    payout.getAmount(),
                    payout.getStatus(),
                    payout.getProcessorTransferId(),
                    payout.getCreatedAt(),
                    payout.getProcessedAt(),
                    payout.getCompetitionId(),
                    competition == null ? null : competition.getTitle(),
                    payout.getSubmissionId(),
                    submission == null ? null : submission.getTitle(),
                    submission == null ? null : submission.getPlacement()
            ));
        }
        return winnings;
    }

    static String idempotencyKey(UUID competitionId, UUID submissionId, String version) {
        return "comp-" + competitionId + "-sub-" + submissionId + "-" + version;
    }

    private void verifyBalanceCovers(UUID competitionId, List<PlannedPayout> plan) {
        BigDecimal owed = BigDecimal.ZERO;
        for (PlannedPayout payout : plan) {
            if (payout.user() != null && payout.user().isPayoutReady() && !hasSettledOrInFlightPayout(payout.submission())) {
                owed = owed.add(payout.amount());
            }
        }
        if (owed.signum() == 0) {
            return;
        }

        ProcessorBalance balance;
        try {
            balance = paymentProcessorClient.getBalance(settlementProperties.getCurrency());
        } catch (PaymentProcessorException ex) {
            log.warn("Could not verify processor balance before payouts: competitionId={}", competitionId, ex);
            return;
        }

        long owedMinor = MoneyAmounts.toMinorUnits(owed);
        if (balance.availableMinor() < owedMinor) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("requiredMinor", owedMinor);
            details.put("availableMinor", balance.availableMinor());
            details.put("currency", balance.currency());
            throw SettlementException.preconditionFailed(
                    "Insufficient processor balance for prize payouts. Required: " + MoneyAmounts.scale(owed)
                            + ", available: " + BigDecimal.valueOf(balance.availableMinor(), 2),
                    details
            );
        }
    }

    private SettlementResponses.PayoutOutcome payOne(Competition competition, PlannedPayout payout) {
        Submission submission = payout.submission();
        User user = payout.user();
        String username = user == null ? null : user.getUsername();

        if (user == null || user.getPayoutAccountId() == null) {
            return outcome(payout, username, OUTCOME_PENDING_ACCOUNT, null, null, "Winner has not connected a payout account");
        }
        if (!user.isPayoutReady()) {
            return outcome(payout, username, OUTCOME_PENDING_ONBOARDING, null, null, "Winner has not completed payout onboarding");
        }
        if (hasSettledOrInFlightPayout(submission)) {
            Payment existing = paymentRepository
                    .findFirstBySubmissionIdAndTypeOrderByCreatedAtDesc(submission.getSubmissionId(), PaymentType.PRIZE_PAYOUT)
                    .orElse(null);
            return outcome(
                    payout,
                    username,
                    OUTCOME_ALREADY_PAID,
                    existing == null ? null : existing.getProcessorTransferId(),
                    existing == null ? null : existing.getPaymentId(),
                    "Prize already paid or in progress"
            );
        }

        String idempotencyKey = idempotencyKey(
                competition.getCompetitionId(),
                submission.getSubmissionId(),
                settlementProperties.getPayoutKeyVersion()
        );
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("competition_id", competition.getCompetitionId().toString());
        metadata.put("submission_id", submission.getSubmissionId().toString());
        metadata.put("user_id", user.getUserId().toString());
        metadata.put("place", submission.getPlacement());
        metadata.put("type", "prize_payout");

        TransferHandle transfer;
        try {
            transfer = paymentProcessorClient.createTransfer(
                    MoneyAmounts.toMinorUnits(payout.amount()),
                    settlementProperties.getCurrency(),
                    user.getPayoutAccountId(),
                    idempotencyKey,
                    metadata
            );
        } catch (PaymentProcessorException ex) {
            log.warn(
                    "Prize transfer failed: competitionId={}, submissionId={}, error={}",
                    competition.getCompetitionId(),
                    submission.getSubmissionId(),
                    ex.getMessage()
            );
            return outcome(payout, username, OUTCOME_ERROR, null, null, ex.getMessage());
        }

        Payment payment = new Payment();
        payment.setPaymentId(UUID.randomUUID());
        payment.setUserId(user.getUserId());
        payment.setCompetitionId(competition.getCompetitionId());
        payment.setSubmissionId(submission.getSubmissionId());
        payment.setType(PaymentType.PRIZE_PAYOUT);
        payment.setStatus(PaymentStatus.PENDING);
        payment.setAmount(payout.amount());
        payment.setProcessorTransferId(transfer.id());
        payment.setIdempotencyKey(idempotencyKey);
        Payment saved = paymentRepository.save(payment);

        log.info(
                "Prize transfer created: competitionId={}, submissionId={}, transferId={}, amount={}",
                competition.getCompetitionId(),
                submission.getSubmissionId(),
                transfer.id(),
                payout.amount()
        );
        return outcome(payout, username, OUTCOME_SUCCESS, transfer.id(), saved.getPaymentId(), null);
    }

    private boolean hasSettledOrInFlightPayout(Submission submission) {
        return paymentRepository.existsBySubmissionIdAndTypeAndStatusIn(
                submission.getSubmissionId(),
                PaymentType.PRIZE_PAYOUT,
                SETTLED_OR_IN_FLIGHT
        );
    }

    private static SettlementResponses.PayoutOutcome outcome(
            PlannedPayout payout,
            String username,
            String outcome,
            String transferId,
            UUID paymentId,
            String message
    ) {
        return new SettlementResponses.PayoutOutcome(
                payout.submission().getSubmissionId(),
                payout.submission().getUserId(),
                username,
                payout.submission().getPlacement(),
                payout.amount(),
                outcome,
                transferId,
                paymentId,
                message
        );
    }

    private record PlannedPayout(Submission submission, User user, BigDecimal amount) {
    }
}
