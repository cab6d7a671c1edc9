package com.seedling.controller;

import com.seedling.dto.JudgingRequests;
import com.seedling.dto.JudgingResponses;
import com.seedling.service.JudgingService;
import com.seedling.web.ActorHeaders;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/judging")
public class JudgingController {

    private final JudgingService judgingService;

    public JudgingController(JudgingService judgingService) {
        this.judgingService = judgingService;
    }

    @GetMapping("/assignments")
    public ResponseEntity<List<JudgingResponses.AssignmentSummary>> getAssignments(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId
    ) {
        return ResponseEntity.ok(judgingService.getJudgeAssignments(actorId));
    }

    @GetMapping("/competitions/{competitionId}/submissions")
    public ResponseEntity<List<JudgingResponses.ScoredSubmission>> listSubmissions(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID competitionId
    ) {
        return ResponseEntity.ok(judgingService.listSubmissionsForJudging(competitionId, actorId));
    }

    @GetMapping("/submissions/{submissionId}")
    public ResponseEntity<JudgingResponses.ScoredSubmission> getSubmission(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID submissionId
    ) {
        return ResponseEntity.ok(judgingService.getSubmissionForJudging(submissionId, actorId));
    }

    @PostMapping("/submissions/{submissionId}/score")
    public ResponseEntity<JudgingResponses.ScoredSubmission> submitScore(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID submissionId,
            @Valid @RequestBody JudgingRequests.SubmitScoreRequest request
    ) {
        return ResponseEntity.ok(judgingService.submitScore(
                submissionId,
                request.criteriaScores(),
                request.feedback(),
                actorId
        ));
    }
}
