package com.avocado.bonus_ledger.admin.dto;

import com.avocado.bonus_ledger.discount.DiscountRecalculationSummary;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class DiscountRecalculationResponse {

    @JsonProperty("total")
    long total;

    @JsonProperty("updated")
    long updated;

    @JsonProperty("discount_total")
    BigDecimal discountTotal;

    public static DiscountRecalculationResponse from(DiscountRecalculationSummary summary) {
        return new DiscountRecalculationResponse(summary.getTotal(), summary.getUpdated(), summary.getDiscountTotal());
    }
}
