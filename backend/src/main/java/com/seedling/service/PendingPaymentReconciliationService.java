package com.seedling.service;

import com.seedling.config.SettlementProperties;
import com.seedling.model.Payment;
import com.seedling.model.PaymentStatus;
import com.seedling.model.PaymentType;
import com.seedling.provider.ChargeHandle;
import com.seedling.provider.ChargeStatus;
import com.seedling.provider.PaymentProcessorClient;
import com.seedling.provider.PaymentProcessorException;
import com.seedling.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Re-polls the processor for entry fees that have been PENDING for a while, for events
 * the webhook path never applied.
 */
@Service
@RequiredArgsConstructor
public class PendingPaymentReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(PendingPaymentReconciliationService.class);

    private final PaymentRepository paymentRepository;
    private final PaymentProcessorClient paymentProcessorClient;
    private final EntryFeeSettlementService entryFeeSettlementService;
    private final SettlementProperties settlementProperties;

    public SweepSummary sweep() {
        SettlementProperties.Sweep sweep = settlementProperties.getSweep();
        OffsetDateTime cutoff = OffsetDateTime.now().minusMinutes(sweep.getMinAgeMinutes());
        List<Payment> stale = paymentRepository.findByTypeAndStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
                PaymentType.ENTRY_FEE,
                PaymentStatus.PENDING,
                cutoff
        );

        int inspected = 0;
        int confirmed = 0;
        int failed = 0;
        int errors = 0;
        for (Payment payment : stale) {
            if (inspected >= sweep.getBatchSize()) {
                break;
            }
            if (payment.getProcessorChargeId() == null) {
                continue;
            }
            inspected++;
            ChargeHandle charge;
            try {
                charge = paymentProcessorClient.getCharge(payment.getProcessorChargeId());
            } catch (PaymentProcessorException ex) {
                errors++;
                log.warn(
                        "Reconciliation lookup failed: paymentId={}, chargeId={}, error={}",
                        payment.getPaymentId(),
                        payment.getProcessorChargeId(),
                        ex.getMessage()
                );
                continue;
            }

            if (charge.status() == ChargeStatus.SUCCEEDED) {
                if (entryFeeSettlementService.confirmEntryFee(payment.getPaymentId())) {
                    confirmed++;
                }
            } else if (charge.status() == ChargeStatus.CANCELED) {
                if (entryFeeSettlementService.failEntryFee(payment.getPaymentId(), "Charge canceled")) {
                    failed++;
                }
            }
        }
        return new SweepSummary(inspected, confirmed, failed, errors);
    }

    public record SweepSummary(
            int inspected,
            int confirmed,
            int failed,
            int errors
    ) {
        public boolean hasWork() {
            return confirmed > 0 || failed > 0 || errors > 0;
        }
    }
}
