package com.seedling.service;

import com.seedling.config.SettlementProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class PendingPaymentReconciliationScheduler {

    private static final Logger log = LoggerFactory.getLogger(PendingPaymentReconciliationScheduler.class);

    private final PendingPaymentReconciliationService pendingPaymentReconciliationService;
    private final SettlementProperties settlementProperties;

    @Scheduled(
            fixedDelayString = "${seedling.settlement.sweep.interval-ms:300000}",
            initialDelayString = "${seedling.settlement.sweep.initial-delay-ms:60000}"
    )
    public void reconcilePendingEntryFees() {
        if (!settlementProperties.getSweep().isEnabled()) {
            return;
        }

        PendingPaymentReconciliationService.SweepSummary summary = pendingPaymentReconciliationService.sweep();
        if (summary.hasWork()) {
            log.info(
                    "Entry-fee reconciliation sweep: inspected={}, confirmed={}, failed={}, errors={}",
                    summary.inspected(),
                    summary.confirmed(),
                    summary.failed(),
                    summary.errors()
            );
        } else {
            log.debug("Entry-fee reconciliation sweep completed with no state changes");
        }
    }
}
