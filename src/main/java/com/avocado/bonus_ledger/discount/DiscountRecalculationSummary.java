package com.avocado.bonus_ledger.discount;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Result of recomputing every discount: all transactions, rows updated, and the
 * sum of positive discounts afterwards.
 */
@Value
public class DiscountRecalculationSummary {
    long total;
    long updated;
    BigDecimal discountTotal;
}
