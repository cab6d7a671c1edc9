package com.seedling.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.seedling.model.CompetitionStatus;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public final class CompetitionResponses {

    private CompetitionResponses() {
    }

    public record CompetitionDetail(
            UUID competitionId,
            String title,
            String description,
            String domain,
            CompetitionStatus status,
            BigDecimal entryFee,
            BigDecimal platformFeePercentage,
            BigDecimal prizePool,
            Integer maxEntries,
            Integer currentEntries,
            OffsetDateTime openDate,
            OffsetDateTime deadline,
            Integer judgingSlaDays,
            JsonNode prizeStructure,
            JsonNode rubric,
            UUID createdBy,
            OffsetDateTime createdAt,
            OffsetDateTime updatedAt
    ) {
    }
}
