package com.avocado.bonus_ledger.discount;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * The part of a receipt not covered by money or bonus:
 * max(sum of line items - paid_sum - paid_bonus, 0), with missing values read as zero.
 */
public final class DiscountCalculation {

    private static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);

    private DiscountCalculation() {
    }

    public static BigDecimal discount(BigDecimal lineItemsTotal, BigDecimal paidSum, BigDecimal paidBonus) {
        BigDecimal uncovered = orZero(lineItemsTotal)
            .subtract(orZero(paidSum))
            .subtract(orZero(paidBonus));
        if (uncovered.signum() <= 0) {
            return ZERO;
        }
        return uncovered.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
