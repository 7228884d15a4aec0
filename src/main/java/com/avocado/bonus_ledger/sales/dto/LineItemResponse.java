package com.avocado.bonus_ledger.sales.dto;

import com.avocado.bonus_ledger.sales.LineItem;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Value
@Builder
public class LineItemResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("transaction_id")
    Long transactionId;

    @JsonProperty("product_id")
    Long productId;

    @JsonProperty("product_name")
    String productName;

    @JsonProperty("quantity")
    BigDecimal quantity;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("sum")
    BigDecimal sum;

    @JsonProperty("created_at")
    LocalDateTime createdAt;

    public static LineItemResponse from(LineItem item) {
        return LineItemResponse.builder()
            .id(item.getId())
            .transactionId(item.getTransactionId())
            .productId(item.getProductId())
            .productName(item.getProductName())
            .quantity(item.getQuantity())
            .price(item.getPrice())
            .sum(item.getLineSum())
            .createdAt(item.getCreatedAt())
            .build();
    }
}
