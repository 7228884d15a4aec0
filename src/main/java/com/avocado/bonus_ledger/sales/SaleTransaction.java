package com.avocado.bonus_ledger.sales;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A point-of-sale transaction as the engines see it.
 *
 * Money fields are in major units. Any of the paid amounts and the bonus percentage
 * may be null, which the engines treat as zero. A null client or close time keeps the
 * sale out of the bonus program.
 */
@Value
public class SaleTransaction {
    Long transactionId;
    Long clientId;
    LocalDateTime dateClose;
    BigDecimal totalSum;
    BigDecimal paidSum;
    BigDecimal paidBonus;
    BigDecimal bonusPercent;
    BigDecimal discount;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
}
