package com.avocado.bonus_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;

@Value
public class DiscountBatchRequest {

    @NotEmpty(message = "At least one transaction ID is required")
    @JsonProperty("transaction_ids")
    List<Long> transactionIds;
}
