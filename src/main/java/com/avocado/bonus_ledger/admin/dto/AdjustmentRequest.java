package com.avocado.bonus_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Manual bonus correction. The amount is signed and in minor units.
 */
@Value
public class AdjustmentRequest {

    @NotNull(message = "Amount is required")
    @JsonProperty("amount_minor")
    Long amountMinor;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;

    @NotBlank(message = "Admin ID is required")
    @JsonProperty("admin_id")
    String adminId;
}
