package com.seedling.provider;

import com.seedling.config.PaymentProcessorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MockPaymentProcessorClientTest {

    private MockPaymentProcessorClient client;

    @BeforeEach
    void setUp() {
        PaymentProcessorProperties properties = new PaymentProcessorProperties();
        properties.getMock().setAvailableBalanceMinor(50_000L);
        client = new MockPaymentProcessorClient(properties);
    }

    @Test
    void chargeStartsAwaitingPaymentAndCanBeCompleted() {
        ChargeHandle charge = client.createCharge(10_000L, "usd", Map.of("type", "entry_fee"));

        assertEquals(ChargeStatus.REQUIRES_PAYMENT_METHOD, client.getCharge(charge.id()).status());

        client.updateChargeStatus(charge.id(), ChargeStatus.SUCCEEDED);

        assertEquals(ChargeStatus.SUCCEEDED, client.getCharge(charge.id()).status());
        assertEquals(charge.clientSecret(), client.getCharge(charge.id()).clientSecret());
    }

    @Test
    void unknownChargeLookupFails() {
        assertThrows(PaymentProcessorException.class, () -> client.getCharge("pi_missing"));
    }

    @Test
    void transfersAreDeduplicatedByIdempotencyKey() {
        TransferHandle first = client.createTransfer(20_000L, "usd", "acct_1", "comp-a-sub-b-v1", Map.of());
        TransferHandle replay = client.createTransfer(20_000L, "usd", "acct_1", "comp-a-sub-b-v1", Map.of());
        TransferHandle other = client.createTransfer(5_000L, "usd", "acct_2", "comp-a-sub-c-v1", Map.of());

        assertEquals(first, replay);
        assertNotEquals(first.id(), other.id());
        assertEquals(2, client.transferCount());
        assertEquals(25_000L, client.getBalance("usd").availableMinor());
    }

    @Test
    void reusedKeyWithDifferentAmountIsRejected() {
        client.createTransfer(20_000L, "usd", "acct_1", "comp-a-sub-b-v1", Map.of());

        assertThrows(
                PaymentProcessorException.class,
                () -> client.createTransfer(30_000L, "usd", "acct_1", "comp-a-sub-b-v1", Map.of())
        );
    }
}
