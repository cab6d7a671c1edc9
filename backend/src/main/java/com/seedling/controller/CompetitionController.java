package com.seedling.controller;

import com.seedling.dto.CompetitionRequests;
import com.seedling.dto.CompetitionResponses;
import com.seedling.dto.LeaderboardResponses;
import com.seedling.dto.SubmissionRequests;
import com.seedling.dto.SubmissionResponses;
import com.seedling.service.CompetitionLifecycleService;
import com.seedling.service.LeaderboardService;
import com.seedling.service.SubmissionService;
import com.seedling.web.ActorHeaders;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/competitions")
public class CompetitionController {

    private final CompetitionLifecycleService competitionLifecycleService;
    private final SubmissionService submissionService;
    private final LeaderboardService leaderboardService;

    public CompetitionController(
            CompetitionLifecycleService competitionLifecycleService,
            SubmissionService submissionService,
            LeaderboardService leaderboardService
    ) {
        this.competitionLifecycleService = competitionLifecycleService;
        this.submissionService = submissionService;
        this.leaderboardService = leaderboardService;
    }

    @PostMapping
    public ResponseEntity<CompetitionResponses.CompetitionDetail> createCompetition(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @Valid @RequestBody CompetitionRequests.CreateCompetitionRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(competitionLifecycleService.createCompetition(request, actorId));
    }

    @GetMapping("/{competitionId}")
    public ResponseEntity<CompetitionResponses.CompetitionDetail> getCompetition(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(competitionLifecycleService.getCompetition(competitionId));
    }

    @PostMapping("/{competitionId}/transition")
    public ResponseEntity<CompetitionResponses.CompetitionDetail> transition(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID competitionId,
            @Valid @RequestBody CompetitionRequests.TransitionRequest request
    ) {
        return ResponseEntity.ok(competitionLifecycleService.transition(competitionId, request.targetStatus(), actorId));
    }

    @DeleteMapping("/{competitionId}")
    public ResponseEntity<Void> deleteCompetition(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID competitionId
    ) {
        competitionLifecycleService.deleteCompetition(competitionId, actorId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{competitionId}/results")
    public ResponseEntity<LeaderboardResponses.PublicResults> getResults(@PathVariable UUID competitionId) {
        return ResponseEntity.ok(leaderboardService.publicResults(competitionId));
    }

    @PostMapping("/{competitionId}/submissions")
    public ResponseEntity<SubmissionResponses.SubmissionDetail> createSubmission(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID competitionId,
            @Valid @RequestBody SubmissionRequests.CreateSubmissionRequest request
    ) {
        SubmissionResponses.SubmissionDetail submission = submissionService.createSubmission(competitionId, request, actorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(submission);
    }
}
