package com.avocado.bonus_ledger.sales.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class UpdateLineItemRequest {

    @DecimalMin(value = "0.000", message = "Quantity must not be negative")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @NotNull(message = "Line item sum is required")
    @DecimalMin(value = "0.00", message = "Line item sum must not be negative")
    @JsonProperty("sum")
    BigDecimal sum;
}
