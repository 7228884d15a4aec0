package com.avocado.bonus_ledger.discount;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One row of a batch discount recomputation.
 */
@Value
public class DiscountChange {
    Long transactionId;
    BigDecimal oldDiscount;
    BigDecimal newDiscount;
    boolean updated;
}
