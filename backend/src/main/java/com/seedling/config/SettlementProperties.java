package com.seedling.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Entry-fee and prize settlement settings.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "seedling.settlement")
public class SettlementProperties {

    /**
     * ISO currency code used for every charge and transfer.
     */
    private String currency = "usd";

    /**
     * Suffix of prize transfer idempotency keys.
     */
    private String payoutKeyVersion = "v1";

    private Sweep sweep = new Sweep();

    @Getter
    @Setter
    public static class Sweep {
        private boolean enabled = false;
        private long intervalMs = 300_000L;
        private long initialDelayMs = 60_000L;
        private long minAgeMinutes = 15L;
        private int batchSize = 50;
    }
}
