package com.seedling.service;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Currency arithmetic shared by the entry-fee and prize paths. All results are 2-place, HALF_UP.
 */
public final class MoneyAmounts {

    private static final BigDecimal ONE_HUNDRED = new BigDecimal("100");

    private MoneyAmounts() {
    }

    public static BigDecimal scale(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    public static long toMinorUnits(BigDecimal amount) {
        return scale(amount).movePointRight(2).longValueExact();
    }

    /**
     * Portion of an entry fee credited to the prize pool.
     */
    public static BigDecimal netEntryFee(BigDecimal entryFee, BigDecimal platformFeePercentage) {
        BigDecimal retainedFraction = BigDecimal.ONE.subtract(platformFeePercentage.divide(ONE_HUNDRED, 6, RoundingMode.HALF_UP));
        return scale(entryFee.multiply(retainedFraction));
    }

    public static BigDecimal prizeFor(BigDecimal prizePool, double fraction) {
        return scale(prizePool.multiply(BigDecimal.valueOf(fraction)));
    }
}
