package com.seedling.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.seedling.config.SettlementProperties;
import com.seedling.dto.SettlementResponses;
import com.seedling.mapper.SeedlingResponseMapper;
import com.seedling.model.Competition;
import com.seedling.model.CompetitionStatus;
import com.seedling.model.Payment;
import com.seedling.model.PaymentStatus;
import com.seedling.model.PaymentType;
import com.seedling.model.Submission;
import com.seedling.model.SubmissionStatus;
import com.seedling.model.User;
import com.seedling.model.UserRole;
import com.seedling.provider.PaymentProcessorClient;
import com.seedling.provider.PaymentProcessorException;
import com.seedling.provider.ProcessorBalance;
import com.seedling.provider.TransferHandle;
import com.seedling.repository.CompetitionRepository;
import com.seedling.repository.PaymentRepository;
import com.seedling.repository.SubmissionRepository;
import com.seedling.repository.UserRepository;
import com.seedling.web.SettlementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PrizeDistributionServiceTest {

    @Mock
    private CompetitionRepository competitionRepository;

    @Mock
    private SubmissionRepository submissionRepository;

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private UserRepository userRepository;

    @Mock
    private PaymentProcessorClient paymentProcessorClient;

    @Mock
    private ActorAccessService actorAccessService;

    private PrizeDistributionService prizeDistributionService;

    private User admin;
    private Competition competition;

    @BeforeEach
    void setUp() {
        prizeDistributionService = new PrizeDistributionService(
                competitionRepository,
                submissionRepository,
                paymentRepository,
                userRepository,
                paymentProcessorClient,
                new SettlementProperties(),
                actorAccessService,
                new SeedlingResponseMapper()
        );

        admin = user("admin", UserRole.ADMIN, null, false);

        ObjectNode prizeStructure = JsonNodeFactory.instance.objectNode();
        prizeStructure.put("first", 0.6);
        prizeStructure.put("second", 0.4);

        competition = new Competition();
        competition.setCompetitionId(UUID.randomUUID());
        competition.setTitle("Climate founders cup");
        competition.setStatus(CompetitionStatus.COMPLETE);
        competition.setPrizePool(new BigDecimal("1000.00"));
        competition.setPrizeStructure(prizeStructure);
    }

    @Test
    void distributePrizesPaysReadyWinnerAndDefersWinnerWithoutAccount() {
        User ready = user("ada", UserRole.FOUNDER, "acct_ada", true);
        User noAccount = user("grace", UserRole.FOUNDER, null, false);
        Submission first = winner(ready, "first");
        Submission second = winner(noAccount, "second");
        stubCompetitionWithWinners(List.of(first, second), List.of(ready, noAccount));
        when(paymentProcessorClient.getBalance("usd")).thenReturn(new ProcessorBalance(100_000_000L, "usd"));
        String expectedKey = PrizeDistributionService.idempotencyKey(
                competition.getCompetitionId(),
                first.getSubmissionId(),
                "v1"
        );
        when(paymentProcessorClient.createTransfer(eq(60_000L), eq("usd"), eq("acct_ada"), eq(expectedKey), anyMap()))
                .thenReturn(new TransferHandle("tr_1", 60_000L, "acct_ada"));
        when(paymentRepository.save(any(Payment.class))).thenAnswer(invocation -> invocation.getArgument(0));

        SettlementResponses.PrizeDistributionResult result =
                prizeDistributionService.distributePrizes(competition.getCompetitionId(), admin.getUserId());

        assertEquals(1, result.successful().size());
        assertEquals("tr_1", result.successful().get(0).transferId());
        assertEquals(1, result.pendingBankInfo().size());
        assertEquals(PrizeDistributionService.OUTCOME_PENDING_ACCOUNT, result.pendingBankInfo().get(0).outcome());
        assertEquals(new BigDecimal("600.00"), result.totalDistributed());
        assertEquals(new BigDecimal("1000.00"), result.totalExpected());
        assertEquals("1 successful, 1 pending bank info, 0 failed, 0 already paid", result.summary());

        ArgumentCaptor<Payment> saved = ArgumentCaptor.forClass(Payment.class);
        verify(paymentRepository).save(saved.capture());
        assertEquals(PaymentType.PRIZE_PAYOUT, saved.getValue().getType());
        assertEquals(PaymentStatus.PENDING, saved.getValue().getStatus());
        assertEquals(new BigDecimal("600.00"), saved.getValue().getAmount());
        assertEquals(expectedKey, saved.getValue().getIdempotencyKey());
    }

    @Test
    void distributePrizesSkipsWinnerWithSettledPayout() {
        User ready = user("ada", UserRole.FOUNDER, "acct_ada", true);
        Submission first = winner(ready, "first");
        stubCompetitionWithWinners(List.of(first), List.of(ready));
        when(paymentRepository.existsBySubmissionIdAndTypeAndStatusIn(
                eq(first.getSubmissionId()),
                eq(PaymentType.PRIZE_PAYOUT),
                any()
        )).thenReturn(true);
        Payment existing = new Payment();
        existing.setPaymentId(UUID.randomUUID());
        existing.setProcessorTransferId("tr_old");
        when(paymentRepository.findFirstBySubmissionIdAndTypeOrderByCreatedAtDesc(first.getSubmissionId(), PaymentType.PRIZE_PAYOUT))
                .thenReturn(Optional.of(existing));

        SettlementResponses.PrizeDistributionResult result =
                prizeDistributionService.distributePrizes(competition.getCompetitionId(), admin.getUserId());

        assertEquals(1, result.alreadyPaid().size());
        assertEquals("tr_old", result.alreadyPaid().get(0).transferId());
        assertEquals(new BigDecimal("0.00"), result.totalDistributed());
        verify(paymentProcessorClient, never()).getBalance(anyString());
        verify(paymentProcessorClient, never()).createTransfer(anyLong(), anyString(), anyString(), anyString(), anyMap());
    }

    @Test
    void distributePrizesRefusesWhenBalanceIsShort() {
        User ready = user("ada", UserRole.FOUNDER, "acct_ada", true);
        Submission first = winner(ready, "first");
        stubCompetitionWithWinners(List.of(first), List.of(ready));
        when(paymentProcessorClient.getBalance("usd")).thenReturn(new ProcessorBalance(50_000L, "usd"));

        SettlementException ex = assertThrows(
                SettlementException.class,
                () -> prizeDistributionService.distributePrizes(competition.getCompetitionId(), admin.getUserId())
        );

        assertEquals(
                "Insufficient processor balance for prize payouts. Required: 600.00, available: 500.00",
                ex.getMessage()
        );
        assertEquals(60_000L, ex.getDetails().get("requiredMinor"));
        verify(paymentProcessorClient, never()).createTransfer(anyLong(), anyString(), anyString(), anyString(), anyMap());
    }

    @Test
    void distributePrizesContinuesWhenBalanceLookupFails() {
        User ready = user("ada", UserRole.FOUNDER, "acct_ada", true);
        Submission first = winner(ready, "first");
        stubCompetitionWithWinners(List.of(first), List.of(ready));
        when(paymentProcessorClient.getBalance("usd")).thenThrow(new PaymentProcessorException("balance unavailable"));
        when(paymentProcessorClient.createTransfer(anyLong(), anyString(), anyString(), anyString(), anyMap()))
                .thenReturn(new TransferHandle("tr_2", 60_000L, "acct_ada"));
        when(paymentRepository.save(any(Payment.class))).thenAnswer(invocation -> invocation.getArgument(0));

        SettlementResponses.PrizeDistributionResult result =
                prizeDistributionService.distributePrizes(competition.getCompetitionId(), admin.getUserId());

        assertEquals(1, result.successful().size());
        assertEquals(new BigDecimal("600.00"), result.totalDistributed());
    }

    @Test
    void distributePrizesReportsTransferErrorAsFailed() {
        User ready = user("ada", UserRole.FOUNDER, "acct_ada", true);
        Submission first = winner(ready, "first");
        stubCompetitionWithWinners(List.of(first), List.of(ready));
        when(paymentProcessorClient.getBalance("usd")).thenReturn(new ProcessorBalance(100_000_000L, "usd"));
        when(paymentProcessorClient.createTransfer(anyLong(), anyString(), anyString(), anyString(), anyMap()))
                .thenThrow(new PaymentProcessorException("account restricted"));

        SettlementResponses.PrizeDistributionResult result =
                prizeDistributionService.distributePrizes(competition.getCompetitionId(), admin.getUserId());

        assertEquals(1, result.failed().size());
        assertEquals("account restricted", result.failed().get(0).message());
        assertEquals("0 successful, 0 pending bank info, 1 failed, 0 already paid", result.summary());
        verify(paymentRepository, never()).save(any(Payment.class));
    }

    @Test
    void distributePrizesRequiresCompleteCompetition() {
        competition.setStatus(CompetitionStatus.JUDGING);
        when(actorAccessService.requireAdmin(admin.getUserId())).thenReturn(admin);
        when(competitionRepository.findByCompetitionIdForUpdate(competition.getCompetitionId()))
                .thenReturn(Optional.of(competition));

        SettlementException ex = assertThrows(
                SettlementException.class,
                () -> prizeDistributionService.distributePrizes(competition.getCompetitionId(), admin.getUserId())
        );

        assertEquals("Competition must be COMPLETE to distribute prizes. Current status: JUDGING", ex.getMessage());
    }

    @Test
    void markTransferPaidCompletesPendingPayout() {
        Payment payout = payout(PaymentStatus.PENDING);
        when(paymentRepository.findByProcessorTransferId("tr_9")).thenReturn(Optional.of(payout));
        when(paymentRepository.completeIfPending(
                eq(payout.getPaymentId()),
                eq(PaymentStatus.PENDING),
                eq(PaymentStatus.COMPLETED),
                any(OffsetDateTime.class)
        )).thenReturn(1);

        assertTrue(prizeDistributionService.markTransferPaid("tr_9"));
        verify(paymentRepository, never()).save(any(Payment.class));
    }

    @Test
    void markTransferFailedIgnoresCompletedPayout() {
        Payment payout = payout(PaymentStatus.COMPLETED);
        when(paymentRepository.findByProcessorTransferId("tr_9")).thenReturn(Optional.of(payout));
        when(paymentRepository.failIfPending(
                eq(payout.getPaymentId()),
                eq(PaymentStatus.PENDING),
                eq(PaymentStatus.FAILED),
                eq("account_closed"),
                any(OffsetDateTime.class)
        )).thenReturn(0);
        when(paymentRepository.findById(payout.getPaymentId())).thenReturn(Optional.of(payout));

        assertFalse(prizeDistributionService.markTransferFailed("tr_9", "account_closed"));
        assertEquals(PaymentStatus.COMPLETED, payout.getStatus());
        verify(paymentRepository, never()).save(any(Payment.class));
    }

    @Test
    void idempotencyKeyIsStablePerCompetitionAndSubmission() {
        UUID competitionId = UUID.fromString("11111111-1111-1111-1111-111111111111");
        UUID submissionId = UUID.fromString("22222222-2222-2222-2222-222222222222");

        assertEquals(
                "comp-11111111-1111-1111-1111-111111111111-sub-22222222-2222-2222-2222-222222222222-v1",
                PrizeDistributionService.idempotencyKey(competitionId, submissionId, "v1")
        );
    }

    private void stubCompetitionWithWinners(List<Submission> winners, List<User> users) {
        when(actorAccessService.requireAdmin(admin.getUserId())).thenReturn(admin);
        when(competitionRepository.findByCompetitionIdForUpdate(competition.getCompetitionId()))
                .thenReturn(Optional.of(competition));
        when(submissionRepository.findByCompetitionIdAndStatusIn(eq(competition.getCompetitionId()), any()))
                .thenReturn(winners);
        when(userRepository.findAllById(any())).thenReturn(users);
    }

    private Submission winner(User owner, String place) {
        Submission submission = new Submission();
        submission.setSubmissionId(UUID.randomUUID());
        submission.setCompetitionId(competition.getCompetitionId());
        submission.setUserId(owner.getUserId());
        submission.setTitle(owner.getUsername() + "'s venture");
        submission.setStatus(SubmissionStatus.WINNER);
        submission.setPlacement(place);
        return submission;
    }

    private Payment payout(PaymentStatus status) {
        Payment payment = new Payment();
        payment.setPaymentId(UUID.randomUUID());
        payment.setType(PaymentType.PRIZE_PAYOUT);
        payment.setStatus(status);
        payment.setProcessorTransferId("tr_9");
        payment.setAmount(new BigDecimal("250.00"));
        return payment;
    }

    private static User user(String username, UserRole role, String payoutAccountId, boolean payoutReady) {
        User user = new User();
        user.setUserId(UUID.randomUUID());
        user.setUsername(username);
        user.setEmail(username + "@example.com");
        user.setRole(role);
        user.setPayoutAccountId(payoutAccountId);
        user.setPayoutOnboardingComplete(payoutReady);
        user.setPayoutsEnabled(payoutReady);
        return user;
    }
}
