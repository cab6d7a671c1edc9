package com.seedling.model;

public enum PaymentStatus {
    PENDING,
    COMPLETED,
    FAILED,
    REFUNDED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
