package com.seedling.controller;

import com.seedling.dto.SubmissionRequests;
import com.seedling.dto.SubmissionResponses;
import com.seedling.service.SubmissionService;
import com.seedling.web.ActorHeaders;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

@RestController
@RequestMapping("/api/submissions")
public class SubmissionController {

    private final SubmissionService submissionService;

    public SubmissionController(SubmissionService submissionService) {
        this.submissionService = submissionService;
    }

    @PatchMapping("/{submissionId}")
    public ResponseEntity<SubmissionResponses.SubmissionDetail> updateSubmission(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID submissionId,
            @Valid @RequestBody SubmissionRequests.UpdateSubmissionRequest request
    ) {
        return ResponseEntity.ok(submissionService.updateSubmission(submissionId, request, actorId));
    }

    @DeleteMapping("/{submissionId}")
    public ResponseEntity<Void> deleteSubmission(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID submissionId
    ) {
        submissionService.deleteSubmission(submissionId, actorId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{submissionId}/payment-intent")
    public ResponseEntity<SubmissionResponses.SubmissionDetail> createPaymentIntent(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID submissionId
    ) {
        return ResponseEntity.ok(submissionService.createPaymentIntent(submissionId, actorId));
    }

    @PostMapping("/{submissionId}/payment-status")
    public ResponseEntity<SubmissionResponses.PaymentStatusCheck> checkPaymentStatus(
            @RequestHeader(ActorHeaders.USER_ID) UUID actorId,
            @PathVariable UUID submissionId
    ) {
        return ResponseEntity.ok(submissionService.checkPaymentStatus(submissionId, actorId));
    }
}
