package com.avocado.bonus_ledger.sales;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class NewLineItem {
    Long productId;
    String productName;
    BigDecimal quantity;
    BigDecimal price;
    BigDecimal lineSum;

    public static NewLineItem of(String productName, BigDecimal lineSum) {
        return new NewLineItem(null, productName, BigDecimal.ONE, lineSum, lineSum);
    }
}
