package com.seedling.provider;

import java.util.Locale;

/**
 * Live status of a charge as reported by the processor.
 */
public enum ChargeStatus {
    REQUIRES_PAYMENT_METHOD,
    REQUIRES_CONFIRMATION,
    REQUIRES_ACTION,
    PROCESSING,
    REQUIRES_CAPTURE,
    CANCELED,
    SUCCEEDED,
    UNKNOWN;

    public static ChargeStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            return UNKNOWN;
        }
    }

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * The payer can still finish this charge without a new one being created.
     */
    public boolean isInProgress() {
        return this == PROCESSING || this == REQUIRES_ACTION || this == REQUIRES_CONFIRMATION;
    }

    /**
     * The charge can no longer succeed and a replacement may be created.
     */
    public boolean isReplaceable() {
        return this == REQUIRES_PAYMENT_METHOD || this == CANCELED;
    }
}
