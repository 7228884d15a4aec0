package com.avocado.bonus_ledger.bonus;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversions between major currency units and the integer minor units the ledger stores.
 *
 * Rounding is half-up, matching PostgreSQL's ROUND on numeric values.
 */
public final class MinorUnits {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private MinorUnits() {
    }

    /**
     * 10.00 becomes 1000; 0.005 becomes 1.
     */
    public static long fromMajor(BigDecimal major) {
        if (major == null) {
            return 0L;
        }
        return major.multiply(HUNDRED).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    public static BigDecimal toMajor(long minor) {
        return BigDecimal.valueOf(minor).divide(HUNDRED).setScale(2, RoundingMode.UNNECESSARY);
    }

    /**
     * Reads a minor-unit amount stored in a numeric column. Null reads as zero.
     */
    public static long fromColumn(BigDecimal stored) {
        if (stored == null) {
            return 0L;
        }
        return stored.setScale(0, RoundingMode.HALF_UP).longValueExact();
    }
}
