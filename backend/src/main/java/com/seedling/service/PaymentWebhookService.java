package com.seedling.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.seedling.dto.SettlementResponses;
import com.seedling.provider.ProcessorEvent;
import com.seedling.provider.WebhookSignatureVerifier;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies authenticated processor events. Signature failures propagate; anything that goes wrong
 * after authentication is logged, counted as pending reconciliation and acknowledged.
 */
@Service
public class PaymentWebhookService {

    private static final Logger log = LoggerFactory.getLogger(PaymentWebhookService.class);

    static final String RECONCILIATION_PENDING_METRIC = "seedling.webhook.reconciliation_pending";

    private final WebhookSignatureVerifier webhookSignatureVerifier;
    private final EntryFeeSettlementService entryFeeSettlementService;
    private final PrizeDistributionService prizeDistributionService;
    private final Counter reconciliationPending;

    public PaymentWebhookService(
            WebhookSignatureVerifier webhookSignatureVerifier,
            EntryFeeSettlementService entryFeeSettlementService,
            PrizeDistributionService prizeDistributionService,
            MeterRegistry meterRegistry
    ) {
        this.webhookSignatureVerifier = webhookSignatureVerifier;
        this.entryFeeSettlementService = entryFeeSettlementService;
        this.prizeDistributionService = prizeDistributionService;
        this.reconciliationPending = Counter.builder(RECONCILIATION_PENDING_METRIC)
                .description("Webhook events acknowledged without being applied")
                .register(meterRegistry);
    }

    public SettlementResponses.WebhookAck handle(String payload, String signatureHeader) {
        ProcessorEvent event = webhookSignatureVerifier.verify(payload, signatureHeader);
        try {
            apply(event);
            return SettlementResponses.WebhookAck.success();
        } catch (RuntimeException ex) {
            reconciliationPending.increment();
            log.error("Webhook event not applied: eventId={}, type={}, objectId={}", event.id(), event.type(), event.objectId(), ex);
            return SettlementResponses.WebhookAck.error(ex.getMessage());
        }
    }

    private void apply(ProcessorEvent event) {
        String objectId = event.objectId();
        switch (event.type()) {
            case "payment_intent.succeeded" -> entryFeeSettlementService.confirmEntryFeeByCharge(objectId);
            case "payment_intent.payment_failed" ->
                    entryFeeSettlementService.failEntryFeeByCharge(objectId, chargeFailureReason(event));
            case "transfer.paid" -> prizeDistributionService.markTransferPaid(objectId);
            case "transfer.failed" -> prizeDistributionService.markTransferFailed(objectId, transferFailureReason(event));
            case "transfer.created" -> log.info("Transfer created: transferId={}, eventId={}", objectId, event.id());
            default -> log.info("Unhandled webhook event type: type={}, eventId={}", event.type(), event.id());
        }
    }

    private static String chargeFailureReason(ProcessorEvent event) {
        JsonNode error = event.object() == null ? null : event.object().path("last_payment_error");
        String message = error == null ? null : error.path("message").asText(null);
        return message == null ? "Payment failed" : message;
    }

    private static String transferFailureReason(ProcessorEvent event) {
        String code = event.textField("failure_code");
        String message = event.textField("failure_message");
        if (code == null && message == null) {
            return "Transfer failed";
        }
        if (code == null) {
            return message;
        }
        return message == null ? code : code + ": " + message;
    }
}
