package com.seedling.provider;

import com.seedling.config.PaymentProcessorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deterministic in-memory processor used for local runs and tests.
 * Charges start in {@code requires_payment_method}; {@link #updateChargeStatus} simulates the payer finishing checkout.
 */
@Component
@ConditionalOnProperty(prefix = "seedling.payments", name = "provider", havingValue = "mock", matchIfMissing = true)
public class MockPaymentProcessorClient implements PaymentProcessorClient {

    private static final Logger log = LoggerFactory.getLogger(MockPaymentProcessorClient.class);

    private final PaymentProcessorProperties paymentProcessorProperties;
    private final AtomicLong chargeSequence = new AtomicLong();
    private final AtomicLong transferSequence = new AtomicLong();
    private final Map<String, ChargeHandle> charges = new ConcurrentHashMap<>();
    private final Map<String, TransferHandle> transfersByIdempotencyKey = new ConcurrentHashMap<>();

    public MockPaymentProcessorClient(PaymentProcessorProperties paymentProcessorProperties) {
        this.paymentProcessorProperties = paymentProcessorProperties;
    }

    @Override
    public ChargeHandle createCharge(long amountMinor, String currency, Map<String, String> metadata) {
        if (amountMinor <= 0) {
            throw new PaymentProcessorException("Charge amount must be positive: " + amountMinor);
        }
        String chargeId = "pi_mock_" + chargeSequence.incrementAndGet();
        ChargeHandle charge = new ChargeHandle(chargeId, chargeId + "_secret_mock", ChargeStatus.REQUIRES_PAYMENT_METHOD);
        charges.put(chargeId, charge);
        log.debug("Mock charge created: id={}, amountMinor={}, currency={}", chargeId, amountMinor, currency);
        return charge;
    }

    @Override
    public ChargeHandle getCharge(String chargeId) {
        ChargeHandle charge = charges.get(chargeId);
        if (charge == null) {
            throw new PaymentProcessorException("No such charge: " + chargeId);
        }
        return charge;
    }

    @Override
    public TransferHandle createTransfer(
            long amountMinor,
            String currency,
            String destination,
            String idempotencyKey,
            Map<String, String> metadata
    ) {
        if (destination == null || destination.isBlank()) {
            throw new PaymentProcessorException("Transfer destination is required");
        }
        TransferHandle transfer = transfersByIdempotencyKey.computeIfAbsent(
                idempotencyKey,
                ignored -> new TransferHandle("tr_mock_" + transferSequence.incrementAndGet(), amountMinor, destination)
        );
        if (transfer.amountMinor() != amountMinor || !transfer.destination().equals(destination)) {
            throw new PaymentProcessorException(
                    "Idempotency key reused with different parameters: " + idempotencyKey
            );
        }
        return transfer;
    }

    @Override
    public ProcessorBalance getBalance(String currency) {
        long transferred = transfersByIdempotencyKey.values().stream()
                .mapToLong(TransferHandle::amountMinor)
                .sum();
        return new ProcessorBalance(
                paymentProcessorProperties.getMock().getAvailableBalanceMinor() - transferred,
                currency
        );
    }

    public ChargeHandle updateChargeStatus(String chargeId, ChargeStatus status) {
        ChargeHandle current = getCharge(chargeId);
        ChargeHandle updated = new ChargeHandle(current.id(), current.clientSecret(), status);
        charges.put(chargeId, updated);
        return updated;
    }

    public int transferCount() {
        return transfersByIdempotencyKey.size();
    }
}
