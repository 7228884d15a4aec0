package com.avocado.bonus_ledger.client.dto;

import com.avocado.bonus_ledger.client.Client;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

@Value
@Builder
public class ClientResponse {

    @JsonProperty("client_id")
    Long clientId;

    @JsonProperty("firstname")
    String firstname;

    @JsonProperty("lastname")
    String lastname;

    @JsonProperty("phone")
    String phone;

    /** Minor units. */
    @JsonProperty("bonus")
    long bonus;

    @JsonProperty("updated_at")
    LocalDateTime updatedAt;

    public static ClientResponse from(Client client) {
        return ClientResponse.builder()
            .clientId(client.getClientId())
            .firstname(client.getFirstname())
            .lastname(client.getLastname())
            .phone(client.getPhone())
            .bonus(client.getBonusBalance())
            .updatedAt(client.getUpdatedAt())
            .build();
    }
}
