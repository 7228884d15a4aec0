package com.avocado.bonus_ledger.client;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Loyalty program member. The bonus balance is in minor units and is only ever
 * written by ledger postings.
 */
@Value
public class Client {
    Long clientId;
    String firstname;
    String lastname;
    String phone;
    long bonusBalance;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;
}
