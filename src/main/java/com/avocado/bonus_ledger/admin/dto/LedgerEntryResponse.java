package com.avocado.bonus_ledger.admin.dto;

import com.avocado.bonus_ledger.bonus.BonusLedgerEntry;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Amounts and balances are in minor units.
 */
@Value
@Builder
public class LedgerEntryResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("transaction_id")
    Long transactionId;

    @JsonProperty("operation_type")
    String operationType;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("balance_before")
    long balanceBefore;

    @JsonProperty("balance_after")
    long balanceAfter;

    @JsonProperty("description")
    String description;

    @JsonProperty("bonus_percent")
    BigDecimal bonusPercent;

    @JsonProperty("transaction_sum")
    BigDecimal transactionSum;

    @JsonProperty("processed_at")
    LocalDateTime processedAt;

    public static LedgerEntryResponse from(BonusLedgerEntry entry) {
        return LedgerEntryResponse.builder()
            .id(entry.getId())
            .transactionId(entry.getTransactionId())
            .operationType(entry.getOperationType().name())
            .amount(entry.getAmount())
            .balanceBefore(entry.getBalanceBefore())
            .balanceAfter(entry.getBalanceAfter())
            .description(entry.getDescription())
            .bonusPercent(entry.getBonusPercent())
            .transactionSum(entry.getTransactionSum())
            .processedAt(entry.getProcessedAt())
            .build();
    }
}
