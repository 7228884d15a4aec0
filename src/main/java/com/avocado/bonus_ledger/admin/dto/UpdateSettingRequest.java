package com.avocado.bonus_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * A missing description keeps the stored one.
 */
@Value
public class UpdateSettingRequest {

    @NotNull(message = "Value is required")
    @JsonProperty("value")
    String value;

    @JsonProperty("description")
    String description;
}
