package com.seedling.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.seedling.model.SubmissionStatus;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public final class SubmissionRequests {

    private SubmissionRequests() {
    }

    public record CreateSubmissionRequest(
            @NotBlank(message = "title is required")
            @Size(max = 200, message = "title must be at most 200 characters")
            String title,

            @Size(max = 10000, message = "description must be at most 10000 characters")
            String description,

            JsonNode attachments,

            SubmissionStatus status
    ) {
        @AssertTrue(message = "attachments must be an array")
        public boolean isAttachmentsArray() {
            return attachments == null || attachments.isNull() || attachments.isArray();
        }
    }

    public record UpdateSubmissionRequest(
            @Size(min = 1, max = 200, message = "title must be between 1 and 200 characters")
            String title,

            @Size(max = 10000, message = "description must be at most 10000 characters")
            String description,

            JsonNode attachments,

            SubmissionStatus status
    ) {
        @AssertTrue(message = "attachments must be an array")
        public boolean isAttachmentsArray() {
            return attachments == null || attachments.isNull() || attachments.isArray();
        }
    }
}
