package com.avocado.bonus_ledger.sales.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import lombok.Value;

import java.math.BigDecimal;

/**
 * New paid amounts of a sale. A missing field clears the stored amount.
 */
@Value
public class UpdatePaymentRequest {

    @DecimalMin(value = "0.00", message = "Paid sum must not be negative")
    @JsonProperty("paid_sum")
    BigDecimal paidSum;

    @DecimalMin(value = "0.00", message = "Paid bonus must not be negative")
    @JsonProperty("paid_bonus")
    BigDecimal paidBonus;
}
