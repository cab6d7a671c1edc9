package com.seedling.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "competitions")
public class Competition {

    @Id
    @Column(name = "competition_id", nullable = false, updatable = false)
    private UUID competitionId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "domain", length = 100)
    private String domain;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private CompetitionStatus status = CompetitionStatus.DRAFT;

    @Column(name = "entry_fee", nullable = false, precision = 10, scale = 2)
    private BigDecimal entryFee = BigDecimal.ZERO;

    @Column(name = "platform_fee_percentage", nullable = false, precision = 5, scale = 2)
    private BigDecimal platformFeePercentage = BigDecimal.ZERO;

    @Column(name = "prize_pool", nullable = false, precision = 10, scale = 2)
    private BigDecimal prizePool = BigDecimal.ZERO;

    @Column(name = "max_entries", nullable = false)
    private Integer maxEntries;

    @Column(name = "current_entries", nullable = false)
    private Integer currentEntries = 0;

    @Column(name = "open_date")
    private OffsetDateTime openDate;

    @Column(name = "deadline")
    private OffsetDateTime deadline;

    @Column(name = "judging_sla_days", nullable = false)
    private Integer judgingSlaDays = 14;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "prize_structure", nullable = false, columnDefinition = "jsonb")
    private JsonNode prizeStructure;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "rubric", columnDefinition = "jsonb")
    private JsonNode rubric;

    @Column(name = "created_by", nullable = false, updatable = false)
    private UUID createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt = OffsetDateTime.now();

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt = OffsetDateTime.now();
}
