package com.seedling.provider;

public record ProcessorBalance(
        long availableMinor,
        String currency
) {
}
