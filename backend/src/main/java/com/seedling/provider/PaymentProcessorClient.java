package com.seedling.provider;

import java.util.Map;

/**
 * Money ledger adapter. Implementations throw {@link PaymentProcessorException} on any processor-side failure.
 */
public interface PaymentProcessorClient {

    ChargeHandle createCharge(long amountMinor, String currency, Map<String, String> metadata);

    ChargeHandle getCharge(String chargeId);

    /**
     * Repeated calls with the same {@code idempotencyKey} return the original transfer.
     */
    TransferHandle createTransfer(
            long amountMinor,
            String currency,
            String destination,
            String idempotencyKey,
            Map<String, String> metadata
    );

    ProcessorBalance getBalance(String currency);
}
