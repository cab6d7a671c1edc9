package com.seedling.controller;

import com.seedling.dto.SettlementResponses;
import com.seedling.provider.WebhookVerificationException;
import com.seedling.service.PaymentWebhookService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Processor webhook receiver. Authenticated events always get a 200 so the processor stops retrying.
 */
@RestController
@RequestMapping("/api/webhooks")
public class PaymentWebhookController {

    private static final Logger log = LoggerFactory.getLogger(PaymentWebhookController.class);
    static final String SIGNATURE_HEADER = "Stripe-Signature";

    private final PaymentWebhookService paymentWebhookService;

    public PaymentWebhookController(PaymentWebhookService paymentWebhookService) {
        this.paymentWebhookService = paymentWebhookService;
    }

    @PostMapping("/payments")
    public ResponseEntity<SettlementResponses.WebhookAck> receive(
            @RequestBody String payload,
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature
    ) {
        return ResponseEntity.ok(paymentWebhookService.handle(payload, signature));
    }

    @ExceptionHandler(WebhookVerificationException.class)
    public ResponseEntity<SettlementResponses.WebhookAck> handleVerificationFailure(WebhookVerificationException ex) {
        log.warn("Rejected webhook: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(SettlementResponses.WebhookAck.error(ex.getMessage()));
    }
}
