package com.avocado.bonus_ledger.admin.dto;

import com.avocado.bonus_ledger.bonus.ClientBonusSummary;
import com.avocado.bonus_ledger.bonus.OperationStatistics;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Bonus report of one client. Amounts and balances are in minor units.
 */
@Value
@Builder
public class ClientBonusResponse {

    @JsonProperty("client_id")
    Long clientId;

    @JsonProperty("firstname")
    String firstname;

    @JsonProperty("lastname")
    String lastname;

    @JsonProperty("stored_balance")
    long storedBalance;

    @JsonProperty("ledger_balance")
    long ledgerBalance;

    @JsonProperty("consistent")
    boolean consistent;

    @JsonProperty("statistics")
    List<Statistics> statistics;

    @JsonProperty("recent_entries")
    List<LedgerEntryResponse> recentEntries;

    public static ClientBonusResponse from(ClientBonusSummary summary) {
        return ClientBonusResponse.builder()
            .clientId(summary.getClientId())
            .firstname(summary.getFirstname())
            .lastname(summary.getLastname())
            .storedBalance(summary.getStoredBalance())
            .ledgerBalance(summary.getLedgerBalance())
            .consistent(summary.isConsistent())
            .statistics(summary.getStatistics().stream().map(Statistics::from).toList())
            .recentEntries(summary.getRecentEntries().stream().map(LedgerEntryResponse::from).toList())
            .build();
    }

    @Value
    public static class Statistics {

        @JsonProperty("operation_type")
        String operationType;

        @JsonProperty("count")
        long count;

        @JsonProperty("total_amount")
        long totalAmount;

        @JsonProperty("last_processed_at")
        LocalDateTime lastProcessedAt;

        static Statistics from(OperationStatistics statistics) {
            return new Statistics(statistics.getOperationType().name(), statistics.getCount(),
                statistics.getTotalAmount(), statistics.getLastProcessedAt());
        }
    }
}
