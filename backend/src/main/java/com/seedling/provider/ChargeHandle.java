package com.seedling.provider;

public record ChargeHandle(
        String id,
        String clientSecret,
        ChargeStatus status
) {
}
