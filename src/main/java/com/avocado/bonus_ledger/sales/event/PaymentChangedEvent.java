package com.avocado.bonus_ledger.sales.event;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Published only when paid_sum or paid_bonus of an existing sale actually changed.
 */
@Value
public class PaymentChangedEvent {
    Long transactionId;
    BigDecimal previousPaidSum;
    BigDecimal previousPaidBonus;
    BigDecimal paidSum;
    BigDecimal paidBonus;
}
