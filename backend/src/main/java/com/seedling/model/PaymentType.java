package com.seedling.model;

public enum PaymentType {
    ENTRY_FEE,
    PRIZE_PAYOUT,
    REFUND
}
