package com.avocado.bonus_ledger.sales.dto;

import com.avocado.bonus_ledger.sales.SaleTransaction;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Response DTO for sales, including the discount computed by the reconciliation engine.
 */
@Value
@Builder
public class SaleResponse {

    @JsonProperty("transaction_id")
    Long transactionId;

    @JsonProperty("client_id")
    Long clientId;

    @JsonProperty("date_close")
    LocalDateTime dateClose;

    @JsonProperty("sum")
    BigDecimal sum;

    @JsonProperty("paid_sum")
    BigDecimal paidSum;

    @JsonProperty("paid_bonus")
    BigDecimal paidBonus;

    @JsonProperty("bonus_percent")
    BigDecimal bonusPercent;

    @JsonProperty("discount")
    BigDecimal discount;

    @JsonProperty("created_at")
    LocalDateTime createdAt;

    @JsonProperty("updated_at")
    LocalDateTime updatedAt;

    public static SaleResponse from(SaleTransaction sale) {
        return SaleResponse.builder()
            .transactionId(sale.getTransactionId())
            .clientId(sale.getClientId())
            .dateClose(sale.getDateClose())
            .sum(sale.getTotalSum())
            .paidSum(sale.getPaidSum())
            .paidBonus(sale.getPaidBonus())
            .bonusPercent(sale.getBonusPercent())
            .discount(sale.getDiscount())
            .createdAt(sale.getCreatedAt())
            .updatedAt(sale.getUpdatedAt())
            .build();
    }
}
