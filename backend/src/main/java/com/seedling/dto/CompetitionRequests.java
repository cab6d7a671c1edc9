package com.seedling.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.seedling.model.CompetitionStatus;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

public final class CompetitionRequests {

    private CompetitionRequests() {
    }

    public record CreateCompetitionRequest(
            @NotBlank(message = "title is required")
            @Size(max = 200, message = "title must be at most 200 characters")
            String title,

            @Size(max = 10000, message = "description must be at most 10000 characters")
            String description,

            @Size(max = 100, message = "domain must be at most 100 characters")
            String domain,

            @NotNull(message = "entryFee is required")
            @DecimalMin(value = "0.0", inclusive = true, message = "entryFee must be non-negative")
            @Digits(integer = 8, fraction = 2, message = "entryFee supports up to 2 decimal places")
            BigDecimal entryFee,

            @NotNull(message = "platformFeePercentage is required")
            @DecimalMin(value = "0.0", inclusive = true, message = "platformFeePercentage must be between 0 and 100")
            @DecimalMax(value = "100.0", inclusive = true, message = "platformFeePercentage must be between 0 and 100")
            BigDecimal platformFeePercentage,

            @NotNull(message = "maxEntries is required")
            @Positive(message = "maxEntries must be positive")
            Integer maxEntries,

            OffsetDateTime openDate,

            OffsetDateTime deadline,

            @Positive(message = "judgingSlaDays must be positive")
            Integer judgingSlaDays,

            @NotNull(message = "prizeStructure is required")
            JsonNode prizeStructure,

            JsonNode rubric
    ) {
        @AssertTrue(message = "deadline must be after openDate")
        public boolean isDeadlineAfterOpenDate() {
            if (openDate == null || deadline == null) {
                return true;
            }
            return deadline.isAfter(openDate);
        }

        @AssertTrue(message = "prizeStructure must be a non-empty object of place to fraction")
        public boolean isPrizeStructureObject() {
            return prizeStructure == null || (prizeStructure.isObject() && !prizeStructure.isEmpty());
        }
    }

    public record TransitionRequest(
            @NotNull(message = "targetStatus is required")
            CompetitionStatus targetStatus
    ) {
    }
}
