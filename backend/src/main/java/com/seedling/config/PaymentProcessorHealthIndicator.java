package com.seedling.config;

import com.seedling.provider.PaymentProcessorClient;
import com.seedling.provider.ProcessorBalance;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class PaymentProcessorHealthIndicator implements HealthIndicator {

    private final PaymentProcessorClient paymentProcessorClient;
    private final SettlementProperties settlementProperties;
    private final PaymentProcessorProperties paymentProcessorProperties;

    public PaymentProcessorHealthIndicator(
            PaymentProcessorClient paymentProcessorClient,
            SettlementProperties settlementProperties,
            PaymentProcessorProperties paymentProcessorProperties
    ) {
        this.paymentProcessorClient = paymentProcessorClient;
        this.settlementProperties = settlementProperties;
        this.paymentProcessorProperties = paymentProcessorProperties;
    }

    @Override
    public Health health() {
        try {
            ProcessorBalance balance = paymentProcessorClient.getBalance(settlementProperties.getCurrency());
            return Health.up()
                    .withDetail("provider", paymentProcessorProperties.getProvider())
                    .withDetail("currency", balance.currency())
                    .withDetail("availableMinor", balance.availableMinor())
                    .build();
        } catch (Exception e) {
            return Health.down()
                    .withDetail("provider", paymentProcessorProperties.getProvider())
                    .withException(e)
                    .build();
        }
    }
}
