package com.seedling.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.UUID;

public final class AdminRequests {

    private AdminRequests() {
    }

    public record JudgeAssignmentSpec(
            @NotNull(message = "judgeId is required")
            UUID judgeId,

            @NotEmpty(message = "submissionIds must not be empty")
            List<@NotNull(message = "submissionIds must not contain null") UUID> submissionIds
    ) {
    }

    public record AssignJudgesRequest(
            @NotEmpty(message = "assignments must not be empty")
            List<@Valid @NotNull JudgeAssignmentSpec> assignments
    ) {
    }

    public record ReassignJudgeRequest(
            @NotNull(message = "judgeId is required")
            UUID judgeId
    ) {
    }

    public record WinnerPick(
            @NotNull(message = "submissionId is required")
            UUID submissionId,

            @NotBlank(message = "place is required")
            String place
    ) {
    }

    public record SelectWinnersRequest(
            @NotEmpty(message = "winners must not be empty")
            List<@Valid @NotNull WinnerPick> winners
    ) {
    }
}
