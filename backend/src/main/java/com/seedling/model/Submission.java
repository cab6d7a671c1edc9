package com.seedling.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "submissions")
public class Submission {

    @Id
    @Column(name = "submission_id", nullable = false, updatable = false)
    private UUID submissionId;

    @Column(name = "competition_id", nullable = false, updatable = false)
    private UUID competitionId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private SubmissionStatus status = SubmissionStatus.DRAFT;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "attachments", columnDefinition = "jsonb")
    private JsonNode attachments;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "human_scores", columnDefinition = "jsonb")
    private JsonNode humanScores;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "ai_scores", columnDefinition = "jsonb")
    private JsonNode aiScores;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "judge_feedback", columnDefinition = "jsonb")
    private JsonNode judgeFeedback;

    @Setter(AccessLevel.NONE)
    @Column(name = "final_score", precision = 10, scale = 2)
    private BigDecimal finalScore;

    @Column(name = "placement", length = 32)
    private String placement;

    @Column(name = "submitted_at")
    private OffsetDateTime submittedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();

    /**
     * Re-derives {@code finalScore} from the stored AI and human aggregates.
     * This is the only writer of the column.
     */
    public void recalculateFinalScore() {
        ScoreAggregate human = JudgeScoresJsonCodec.aggregateFromJson(humanScores);
        ScoreAggregate ai = JudgeScoresJsonCodec.aggregateFromJson(aiScores);
        if (human.judges().isEmpty() && ai.judges().isEmpty()) {
            finalScore = null;
            return;
        }
        double blended = ScoringWeights.AI_WEIGHT * ai.average() + ScoringWeights.HUMAN_WEIGHT * human.average();
        finalScore = BigDecimal.valueOf(blended).setScale(2, RoundingMode.HALF_UP);
    }
}
