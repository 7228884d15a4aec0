package com.avocado.bonus_ledger.sales;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Input for recording a sale, from the REST API or the POS sync feed.
 */
@Value
@Builder
public class NewSale {
    Long transactionId;
    Long clientId;
    LocalDateTime dateClose;
    BigDecimal totalSum;
    BigDecimal paidSum;
    BigDecimal paidBonus;
    BigDecimal bonusPercent;
    @Singular
    List<NewLineItem> lineItems;
}
