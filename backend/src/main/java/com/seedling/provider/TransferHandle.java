package com.seedling.provider;

public record TransferHandle(
        String id,
        long amountMinor,
        String destination
) {
}
