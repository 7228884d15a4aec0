package com.avocado.bonus_ledger.client.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RegisterClientRequest {

    @Size(max = 255)
    @JsonProperty("firstname")
    String firstname;

    @Size(max = 255)
    @JsonProperty("lastname")
    String lastname;

    @Size(max = 50)
    @JsonProperty("phone")
    String phone;
}
