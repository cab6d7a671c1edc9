package com.seedling.controller;

import com.seedling.dto.SettlementResponses;
import com.seedling.service.JudgeAssignmentService;
import com.seedling.service.LeaderboardService;
import com.seedling.service.PrizeDistributionService;
import com.seedling.service.WinnerSelectionService;
import com.seedling.web.ActorHeaders;
import com.seedling.web.SettlementException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AdminCompetitionController.class)
class AdminCompetitionControllerTest {

    private static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID COMPETITION_ID = UUID.fromString("00000000-0000-0000-0000-000000000c01");
    private static final UUID FIRST_ID = UUID.fromString("00000000-0000-0000-0000-000000000501");
    private static final UUID SECOND_ID = UUID.fromString("00000000-0000-0000-0000-000000000502");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private JudgeAssignmentService judgeAssignmentService;

    @MockitoBean
    private LeaderboardService leaderboardService;

    @MockitoBean
    private WinnerSelectionService winnerSelectionService;

    @MockitoBean
    private PrizeDistributionService prizeDistributionService;

    @Test
    void selectWinnersReturnsSelectedWinners() throws Exception {
        when(winnerSelectionService.selectWinners(eq(COMPETITION_ID), anyList(), eq(ADMIN_ID)))
                .thenReturn(new SettlementResponses.WinnerSelectionResult(
                        COMPETITION_ID,
                        List.of(
                                new SettlementResponses.SelectedWinner(FIRST_ID, "Compost robots", UUID.randomUUID(), "first", new BigDecimal("600.00")),
                                new SettlementResponses.SelectedWinner(SECOND_ID, "Tidal buoy", UUID.randomUUID(), "second", new BigDecimal("400.00"))
                        ),
                        3
                ));

        mockMvc.perform(post("/api/admin/competitions/{competitionId}/winners", COMPETITION_ID)
                        .header(ActorHeaders.USER_ID, ADMIN_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "winners": [
                                    {"submissionId": "00000000-0000-0000-0000-000000000501", "place": "first"},
                                    {"submissionId": "00000000-0000-0000-0000-000000000502", "place": "second"}
                                  ]
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.winners.length()").value(2))
                .andExpect(jsonPath("$.winners[0].place").value("first"))
                .andExpect(jsonPath("$.winners[0].prizeAmount").value(600.00))
                .andExpect(jsonPath("$.notSelectedCount").value(3));
    }

    @Test
    void selectWinnersPreconditionFailureMapsToConflict() throws Exception {
        when(winnerSelectionService.selectWinners(eq(COMPETITION_ID), anyList(), eq(ADMIN_ID)))
                .thenThrow(SettlementException.preconditionFailed(
                        "Cannot select winners. 2 submissions still need judging.",
                        Map.of("pendingJudging", 2)
                ));

        mockMvc.perform(post("/api/admin/competitions/{competitionId}/winners", COMPETITION_ID)
                        .header(ActorHeaders.USER_ID, ADMIN_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"winners": [{"submissionId": "00000000-0000-0000-0000-000000000501", "place": "first"}]}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("precondition_failed"))
                .andExpect(jsonPath("$.message").value("Cannot select winners. 2 submissions still need judging."))
                .andExpect(jsonPath("$.details.pendingJudging").value(2));
    }

    @Test
    void selectWinnersRejectsEmptyPicks() throws Exception {
        mockMvc.perform(post("/api/admin/competitions/{competitionId}/winners", COMPETITION_ID)
                        .header(ActorHeaders.USER_ID, ADMIN_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"winners": []}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.winners").value("winners must not be empty"));

        verify(winnerSelectionService, never()).selectWinners(any(), anyList(), any());
    }

    @Test
    void missingActorHeaderIsRejected() throws Exception {
        mockMvc.perform(post("/api/admin/competitions/{competitionId}/distribute-prizes", COMPETITION_ID))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Missing required header: X-User-Id"));

        verify(prizeDistributionService, never()).distributePrizes(any(), any());
    }

    @Test
    void distributePrizesReturnsSummary() throws Exception {
        when(prizeDistributionService.distributePrizes(COMPETITION_ID, ADMIN_ID))
                .thenReturn(new SettlementResponses.PrizeDistributionResult(
                        COMPETITION_ID,
                        List.of(),
                        List.of(),
                        List.of(),
                        List.of(),
                        new BigDecimal("0.00"),
                        new BigDecimal("1000.00"),
                        "0 successful, 2 pending bank info, 0 failed, 0 already paid"
                ));

        mockMvc.perform(post("/api/admin/competitions/{competitionId}/distribute-prizes", COMPETITION_ID)
                        .header(ActorHeaders.USER_ID, ADMIN_ID.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary").value("0 successful, 2 pending bank info, 0 failed, 0 already paid"))
                .andExpect(jsonPath("$.totalExpected").value(1000.00));
    }

    @Test
    void assignJudgesPassesReplaceFlag() throws Exception {
        UUID judgeId = UUID.fromString("00000000-0000-0000-0000-0000000000b7");
        when(judgeAssignmentService.assignJudges(eq(COMPETITION_ID), any(), eq(true), eq(ADMIN_ID)))
                .thenReturn(List.of(new SettlementResponses.JudgeAssignmentView(
                        UUID.randomUUID(),
                        COMPETITION_ID,
                        FIRST_ID,
                        judgeId,
                        "marie",
                        ADMIN_ID,
                        OffsetDateTime.parse("2026-05-01T10:00:00Z"),
                        null
                )));

        mockMvc.perform(post("/api/admin/competitions/{competitionId}/judge-assignments", COMPETITION_ID)
                        .param("replace", "true")
                        .header(ActorHeaders.USER_ID, ADMIN_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "assignments": [
                                    {
                                      "judgeId": "00000000-0000-0000-0000-0000000000b7",
                                      "submissionIds": ["00000000-0000-0000-0000-000000000501"]
                                    }
                                  ]
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$[0].judgeUsername").value("marie"))
                .andExpect(jsonPath("$[0].submissionId").value(FIRST_ID.toString()));
    }
}
