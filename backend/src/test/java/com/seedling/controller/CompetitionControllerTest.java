package com.seedling.controller;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.seedling.dto.CompetitionResponses;
import com.seedling.dto.LeaderboardResponses;
import com.seedling.dto.SubmissionResponses;
import com.seedling.model.CompetitionStatus;
import com.seedling.model.SubmissionStatus;
import com.seedling.service.CompetitionLifecycleService;
import com.seedling.service.LeaderboardService;
import com.seedling.service.SubmissionService;
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
import java.util.UUID;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(CompetitionController.class)
class CompetitionControllerTest {

    private static final UUID ADMIN_ID = UUID.fromString("00000000-0000-0000-0000-0000000000a1");
    private static final UUID FOUNDER_ID = UUID.fromString("00000000-0000-0000-0000-0000000000f1");
    private static final UUID COMPETITION_ID = UUID.fromString("00000000-0000-0000-0000-000000000c01");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CompetitionLifecycleService competitionLifecycleService;

    @MockitoBean
    private SubmissionService submissionService;

    @MockitoBean
    private LeaderboardService leaderboardService;

    @Test
    void createCompetitionReturnsCreatedPayload() throws Exception {
        when(competitionLifecycleService.createCompetition(any(), eq(ADMIN_ID)))
                .thenReturn(sampleCompetition(CompetitionStatus.DRAFT));

        mockMvc.perform(post("/api/competitions")
                        .header(ActorHeaders.USER_ID, ADMIN_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "title": "Soil health sprint",
                                  "entryFee": 25.00,
                                  "platformFeePercentage": 10,
                                  "maxEntries": 100,
                                  "prizeStructure": {"first": 0.7, "second": 0.3}
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.competitionId").value(COMPETITION_ID.toString()))
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.prizeStructure.first").value(0.7));
    }

    @Test
    void createCompetitionValidationFailureReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/competitions")
                        .header(ActorHeaders.USER_ID, ADMIN_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "title": "",
                                  "entryFee": -5,
                                  "platformFeePercentage": 120,
                                  "maxEntries": 0,
                                  "prizeStructure": {"first": 1.0}
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.entryFee").value("entryFee must be non-negative"))
                .andExpect(jsonPath("$.fieldErrors.maxEntries").value("maxEntries must be positive"));

        verify(competitionLifecycleService, never()).createCompetition(any(), any());
    }

    @Test
    void transitionRejectionMapsToConflict() throws Exception {
        when(competitionLifecycleService.transition(COMPETITION_ID, CompetitionStatus.ACTIVE, ADMIN_ID))
                .thenThrow(SettlementException.preconditionFailed(
                        "Cannot transition competition from DRAFT to ACTIVE; required current status: UPCOMING"
                ));

        mockMvc.perform(post("/api/competitions/{competitionId}/transition", COMPETITION_ID)
                        .header(ActorHeaders.USER_ID, ADMIN_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"targetStatus": "ACTIVE"}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.message")
                        .value("Cannot transition competition from DRAFT to ACTIVE; required current status: UPCOMING"));
    }

    @Test
    void transitionReturnsUpdatedCompetition() throws Exception {
        when(competitionLifecycleService.transition(COMPETITION_ID, CompetitionStatus.UPCOMING, ADMIN_ID))
                .thenReturn(sampleCompetition(CompetitionStatus.UPCOMING));

        mockMvc.perform(post("/api/competitions/{competitionId}/transition", COMPETITION_ID)
                        .header(ActorHeaders.USER_ID, ADMIN_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"targetStatus": "UPCOMING"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UPCOMING"));
    }

    @Test
    void unknownCompetitionReturnsNotFound() throws Exception {
        when(competitionLifecycleService.getCompetition(COMPETITION_ID))
                .thenThrow(SettlementException.notFound("Competition not found: " + COMPETITION_ID));

        mockMvc.perform(get("/api/competitions/{competitionId}", COMPETITION_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("not_found"));
    }

    @Test
    void deleteCompetitionReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/competitions/{competitionId}", COMPETITION_ID)
                        .header(ActorHeaders.USER_ID, ADMIN_ID.toString()))
                .andExpect(status().isNoContent());

        verify(competitionLifecycleService).deleteCompetition(COMPETITION_ID, ADMIN_ID);
    }

    @Test
    void publicResultsHideLosingUsernames() throws Exception {
        when(leaderboardService.publicResults(COMPETITION_ID)).thenReturn(new LeaderboardResponses.PublicResults(
                COMPETITION_ID,
                "Soil health sprint",
                new BigDecimal("1000.00"),
                List.of(
                        new LeaderboardResponses.PublicResultEntry(1, UUID.randomUUID(), "Compost robots", "ada", "first", new BigDecimal("8.50"), false),
                        new LeaderboardResponses.PublicResultEntry(2, UUID.randomUUID(), "Tidal buoy", null, null, new BigDecimal("7.25"), false)
                )
        ));

        mockMvc.perform(get("/api/competitions/{competitionId}/results", COMPETITION_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.entries[0].username").value("ada"))
                .andExpect(jsonPath("$.entries[1].username").value(nullValue()));
    }

    @Test
    void createSubmissionReturnsClientSecret() throws Exception {
        UUID submissionId = UUID.fromString("00000000-0000-0000-0000-000000000501");
        when(submissionService.createSubmission(eq(COMPETITION_ID), any(), eq(FOUNDER_ID)))
                .thenReturn(new SubmissionResponses.SubmissionDetail(
                        submissionId,
                        COMPETITION_ID,
                        FOUNDER_ID,
                        "Compost robots",
                        null,
                        SubmissionStatus.PENDING_PAYMENT,
                        null,
                        null,
                        null,
                        null,
                        OffsetDateTime.parse("2026-05-01T10:00:00Z"),
                        OffsetDateTime.parse("2026-05-01T10:00:00Z"),
                        "pi_secret_123"
                ));

        mockMvc.perform(post("/api/competitions/{competitionId}/submissions", COMPETITION_ID)
                        .header(ActorHeaders.USER_ID, FOUNDER_ID.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title": "Compost robots", "status": "SUBMITTED"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("PENDING_PAYMENT"))
                .andExpect(jsonPath("$.paymentClientSecret").value("pi_secret_123"));
    }

    private static CompetitionResponses.CompetitionDetail sampleCompetition(CompetitionStatus status) {
        ObjectNode prizeStructure = JsonNodeFactory.instance.objectNode();
        prizeStructure.put("first", 0.7);
        prizeStructure.put("second", 0.3);
        return new CompetitionResponses.CompetitionDetail(
                COMPETITION_ID,
                "Soil health sprint",
                null,
                null,
                status,
                new BigDecimal("25.00"),
                new BigDecimal("10.00"),
                new BigDecimal("0.00"),
                100,
                0,
                null,
                null,
                14,
                prizeStructure,
                null,
                ADMIN_ID,
                OffsetDateTime.parse("2026-05-01T10:00:00Z"),
                OffsetDateTime.parse("2026-05-01T10:00:00Z")
        );
    }
}
