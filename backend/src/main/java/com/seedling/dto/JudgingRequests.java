package com.seedling.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.Map;

public final class JudgingRequests {

    private JudgingRequests() {
    }

    public record SubmitScoreRequest(
            @NotEmpty(message = "criteriaScores is required")
            Map<String, @NotNull(message = "criterion scores must not be null") Double> criteriaScores,

            @Size(max = 5000, message = "feedback must be at most 5000 characters")
            String feedback
    ) {
    }
}
