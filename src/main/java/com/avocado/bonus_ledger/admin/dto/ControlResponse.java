package com.avocado.bonus_ledger.admin.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ControlResponse {

    @JsonProperty("message")
    String message;
}
