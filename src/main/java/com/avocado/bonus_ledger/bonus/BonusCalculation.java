package com.avocado.bonus_ledger.bonus;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Bonus amounts earned and spent on one sale.
 *
 * earned = round(sum * percent / 100, 2) when percent is positive, otherwise zero;
 * spent = the amount paid with bonus, zero when absent. Both are also kept in minor units.
 */
@Value
public class BonusCalculation {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    BigDecimal earned;
    BigDecimal spent;
    long earnedMinor;
    long spentMinor;

    public static BonusCalculation of(BigDecimal totalSum, BigDecimal bonusPercent, BigDecimal paidBonus) {
        BigDecimal earned = BigDecimal.ZERO.setScale(2);
        if (bonusPercent != null && bonusPercent.signum() > 0 && totalSum != null) {
            earned = totalSum.multiply(bonusPercent).divide(HUNDRED, 2, RoundingMode.HALF_UP);
        }
        BigDecimal spent = paidBonus != null ? paidBonus : BigDecimal.ZERO;
        return new BonusCalculation(earned, spent, MinorUnits.fromMajor(earned), MinorUnits.fromMajor(spent));
    }

    public boolean hasEarning() {
        return earnedMinor > 0;
    }

    public boolean hasSpending() {
        return spentMinor > 0;
    }
}
