package com.seedling.service;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.seedling.dto.CompetitionRequests;
import com.seedling.dto.CompetitionResponses;
import com.seedling.mapper.SeedlingResponseMapper;
import com.seedling.model.Competition;
import com.seedling.model.CompetitionStatus;
import com.seedling.model.SubmissionStatus;
import com.seedling.model.User;
import com.seedling.model.UserRole;
import com.seedling.repository.CompetitionRepository;
import com.seedling.repository.SubmissionRepository;
import com.seedling.web.SettlementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CompetitionLifecycleServiceTest {

    @Mock
    private CompetitionRepository competitionRepository;

    @Mock
    private SubmissionRepository submissionRepository;

    @Mock
    private ActorAccessService actorAccessService;

    @Mock
    private ParticipantNotifier participantNotifier;

    private CompetitionLifecycleService competitionLifecycleService;

    private User admin;
    private Competition competition;

    @BeforeEach
    void setUp() {
        competitionLifecycleService = new CompetitionLifecycleService(
                competitionRepository,
                submissionRepository,
                actorAccessService,
                participantNotifier,
                new SeedlingResponseMapper()
        );

        admin = new User();
        admin.setUserId(UUID.randomUUID());
        admin.setUsername("admin");
        admin.setRole(UserRole.ADMIN);

        competition = new Competition();
        competition.setCompetitionId(UUID.randomUUID());
        competition.setTitle("Water tech challenge");
        competition.setPrizeStructure(twoPlaces());
    }

    @Test
    void transitionMovesOneStepForward() {
        competition.setStatus(CompetitionStatus.ACTIVE);
        stubLockedCompetition();
        when(competitionRepository.save(any(Competition.class))).thenAnswer(invocation -> invocation.getArgument(0));

        CompetitionResponses.CompetitionDetail detail =
                competitionLifecycleService.transition(competition.getCompetitionId(), CompetitionStatus.CLOSED, admin.getUserId());

        assertEquals(CompetitionStatus.CLOSED, detail.status());
        verify(participantNotifier, never()).competitionAnnounced(any());
    }

    @Test
    void transitionRejectsSkippedState() {
        competition.setStatus(CompetitionStatus.DRAFT);
        stubLockedCompetition();

        SettlementException ex = assertThrows(
                SettlementException.class,
                () -> competitionLifecycleService.transition(
                        competition.getCompetitionId(),
                        CompetitionStatus.ACTIVE,
                        admin.getUserId()
                )
        );

        assertEquals(
                "Cannot transition competition from DRAFT to ACTIVE; required current status: UPCOMING",
                ex.getMessage()
        );
        assertEquals(CompetitionStatus.UPCOMING, ex.getDetails().get("requiredStatus"));
        verify(competitionRepository, never()).save(any(Competition.class));
    }

    @Test
    void transitionRejectsBackwardMove() {
        competition.setStatus(CompetitionStatus.JUDGING);
        stubLockedCompetition();

        assertThrows(
                SettlementException.class,
                () -> competitionLifecycleService.transition(
                        competition.getCompetitionId(),
                        CompetitionStatus.ACTIVE,
                        admin.getUserId()
                )
        );
        assertEquals(CompetitionStatus.JUDGING, competition.getStatus());
    }

    @Test
    void announcingCompetitionToleratesNotifierFailure() {
        competition.setStatus(CompetitionStatus.DRAFT);
        stubLockedCompetition();
        when(competitionRepository.save(any(Competition.class))).thenAnswer(invocation -> invocation.getArgument(0));
        doThrow(new IllegalStateException("mail relay unavailable")).when(participantNotifier).competitionAnnounced(competition);

        CompetitionResponses.CompetitionDetail detail =
                competitionLifecycleService.transition(competition.getCompetitionId(), CompetitionStatus.UPCOMING, admin.getUserId());

        assertEquals(CompetitionStatus.UPCOMING, detail.status());
    }

    @Test
    void completeRequiresSelectedWinners() {
        competition.setStatus(CompetitionStatus.JUDGING);
        stubLockedCompetition();
        when(submissionRepository.countByCompetitionIdAndStatus(competition.getCompetitionId(), SubmissionStatus.WINNER))
                .thenReturn(0L);

        SettlementException ex = assertThrows(
                SettlementException.class,
                () -> competitionLifecycleService.transition(
                        competition.getCompetitionId(),
                        CompetitionStatus.COMPLETE,
                        admin.getUserId()
                )
        );

        assertEquals("Cannot complete competition without selected winners", ex.getMessage());
    }

    @Test
    void completeRequiresOneWinnerPerPlace() {
        competition.setStatus(CompetitionStatus.JUDGING);
        stubLockedCompetition();
        when(submissionRepository.countByCompetitionIdAndStatus(competition.getCompetitionId(), SubmissionStatus.WINNER))
                .thenReturn(1L);

        SettlementException ex = assertThrows(
                SettlementException.class,
                () -> competitionLifecycleService.transition(
                        competition.getCompetitionId(),
                        CompetitionStatus.COMPLETE,
                        admin.getUserId()
                )
        );

        assertEquals("Winner count (1) does not match prize structure (2 places)", ex.getMessage());
    }

    @Test
    void completeSucceedsWithFullWinnerSet() {
        competition.setStatus(CompetitionStatus.JUDGING);
        stubLockedCompetition();
        when(submissionRepository.countByCompetitionIdAndStatus(competition.getCompetitionId(), SubmissionStatus.WINNER))
                .thenReturn(2L);
        when(competitionRepository.save(any(Competition.class))).thenAnswer(invocation -> invocation.getArgument(0));

        CompetitionResponses.CompetitionDetail detail = competitionLifecycleService.transition(
                competition.getCompetitionId(),
                CompetitionStatus.COMPLETE,
                admin.getUserId()
        );

        assertEquals(CompetitionStatus.COMPLETE, detail.status());
    }

    @Test
    void createCompetitionStartsAsDraftWithEmptyPool() {
        when(actorAccessService.requireAdmin(admin.getUserId())).thenReturn(admin);
        when(competitionRepository.save(any(Competition.class))).thenAnswer(invocation -> invocation.getArgument(0));
        CompetitionRequests.CreateCompetitionRequest request = new CompetitionRequests.CreateCompetitionRequest(
                "  Soil health sprint  ",
                "Build something for farmers",
                "agritech",
                new BigDecimal("25"),
                new BigDecimal("10"),
                100,
                null,
                null,
                null,
                twoPlaces(),
                null
        );

        CompetitionResponses.CompetitionDetail detail = competitionLifecycleService.createCompetition(request, admin.getUserId());

        assertEquals("Soil health sprint", detail.title());
        assertEquals(CompetitionStatus.DRAFT, detail.status());
        assertEquals(new BigDecimal("0.00"), detail.prizePool());
        assertEquals(new BigDecimal("25.00"), detail.entryFee());
        assertEquals(0, detail.currentEntries());
        assertEquals(14, detail.judgingSlaDays());
        assertEquals(admin.getUserId(), detail.createdBy());
    }

    @Test
    void createCompetitionRejectsNegativePrizeFraction() {
        when(actorAccessService.requireAdmin(admin.getUserId())).thenReturn(admin);
        ObjectNode prizeStructure = JsonNodeFactory.instance.objectNode();
        prizeStructure.put("first", -0.5);
        CompetitionRequests.CreateCompetitionRequest request = new CompetitionRequests.CreateCompetitionRequest(
                "Broken prizes",
                null,
                null,
                BigDecimal.ZERO,
                BigDecimal.ZERO,
                10,
                null,
                null,
                null,
                prizeStructure,
                null
        );

        SettlementException ex = assertThrows(
                SettlementException.class,
                () -> competitionLifecycleService.createCompetition(request, admin.getUserId())
        );

        assertEquals("Prize fraction for place 'first' must be non-negative", ex.getMessage());
        verify(competitionRepository, never()).save(any(Competition.class));
    }

    @Test
    void deleteCompetitionOnlyAllowsDraft() {
        competition.setStatus(CompetitionStatus.UPCOMING);
        competition.setCreatedBy(admin.getUserId());
        when(actorAccessService.requireUser(admin.getUserId())).thenReturn(admin);
        when(competitionRepository.findByCompetitionIdForUpdate(competition.getCompetitionId()))
                .thenReturn(Optional.of(competition));

        SettlementException ex = assertThrows(
                SettlementException.class,
                () -> competitionLifecycleService.deleteCompetition(competition.getCompetitionId(), admin.getUserId())
        );

        assertEquals("Only DRAFT competitions can be deleted. Current status: UPCOMING", ex.getMessage());
        verify(competitionRepository, never()).delete(any(Competition.class));
    }

    private void stubLockedCompetition() {
        when(actorAccessService.requireAdmin(admin.getUserId())).thenReturn(admin);
        when(competitionRepository.findByCompetitionIdForUpdate(competition.getCompetitionId()))
                .thenReturn(Optional.of(competition));
    }

    private static ObjectNode twoPlaces() {
        ObjectNode prizeStructure = JsonNodeFactory.instance.objectNode();
        prizeStructure.put("first", 0.7);
        prizeStructure.put("second", 0.3);
        return prizeStructure;
    }
}
