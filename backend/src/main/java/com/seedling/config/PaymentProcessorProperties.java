package com.seedling.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings for the external payment processor.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "seedling.payments")
public class PaymentProcessorProperties {

    /**
     * {@code mock} for the deterministic in-memory processor, {@code stripe} for the live API.
     */
    private String provider = "mock";

    private String apiBaseUrl = "https://api.stripe.com";
    private String secretKey = "";
    private String webhookSecret = "";
    private long signatureToleranceSeconds = 300L;
    private int connectTimeoutMs = 5_000;
    private int readTimeoutMs = 15_000;
    private Mock mock = new Mock();

    @Getter
    @Setter
    public static class Mock {
        private long availableBalanceMinor = 100_000_000L;
    }
}
