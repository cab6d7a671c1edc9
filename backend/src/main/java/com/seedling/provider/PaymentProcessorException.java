package com.seedling.provider;

/**
 * A processor call failed or returned an unusable response.
 */
public class PaymentProcessorException extends RuntimeException {

    public PaymentProcessorException(String message) {
        super(message);
    }

    public PaymentProcessorException(String message, Throwable cause) {
        super(message, cause);
    }
}
