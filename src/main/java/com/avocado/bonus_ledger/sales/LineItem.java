package com.avocado.bonus_ledger.sales;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Value
public class LineItem {
    Long id;
    Long transactionId;
    Long productId;
    String productName;
    BigDecimal quantity;
    BigDecimal price;
    BigDecimal lineSum;
    LocalDateTime createdAt;
}
