package com.avocado.bonus_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class DiscountPreviewResponse {

    @JsonProperty("transaction_id")
    Long transactionId;

    @JsonProperty("discount")
    BigDecimal discount;
}
