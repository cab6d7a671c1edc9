package com.seedling.repository;

import com.seedling.model.Payment;
import com.seedling.model.PaymentStatus;
import com.seedling.model.PaymentType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    Optional<Payment> findByProcessorChargeId(String processorChargeId);

    Optional<Payment> findByProcessorTransferId(String processorTransferId);

    Optional<Payment> findFirstBySubmissionIdAndTypeAndStatus(
            UUID submissionId,
            PaymentType type,
            PaymentStatus status
    );

    Optional<Payment> findFirstBySubmissionIdAndTypeOrderByCreatedAtDesc(UUID submissionId, PaymentType type);

    boolean existsBySubmissionIdAndTypeAndStatusIn(
            UUID submissionId,
            PaymentType type,
            Collection<PaymentStatus> statuses
    );

    boolean existsBySubmissionId(UUID submissionId);

    List<Payment> findByCompetitionIdAndTypeOrderByCreatedAtAsc(UUID competitionId, PaymentType type);

    List<Payment> findByUserIdAndTypeOrderByCreatedAtDesc(UUID userId, PaymentType type);

    List<Payment> findByTypeAndStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
            PaymentType type,
            PaymentStatus status,
            OffsetDateTime createdBefore
    );

    /**
     * Completes the payment only if it is still PENDING. The row count is the idempotency
     * decision; the persistence context is cleared so later reads see the committed row.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Payment p " +
            "SET p.status = :completed, p.processedAt = :processedAt, p.updatedAt = :processedAt, p.failureReason = null " +
            "WHERE p.paymentId = :paymentId " +
            "AND p.status = :pending")
    int completeIfPending(@Param("paymentId") UUID paymentId,
                          @Param("pending") PaymentStatus pending,
                          @Param("completed") PaymentStatus completed,
                          @Param("processedAt") OffsetDateTime processedAt);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Payment p " +
            "SET p.status = :failed, p.failureReason = :reason, p.processedAt = :processedAt, p.updatedAt = :processedAt " +
            "WHERE p.paymentId = :paymentId " +
            "AND p.status = :pending")
    int failIfPending(@Param("paymentId") UUID paymentId,
                      @Param("pending") PaymentStatus pending,
                      @Param("failed") PaymentStatus failed,
                      @Param("reason") String reason,
                      @Param("processedAt") OffsetDateTime processedAt);
}
