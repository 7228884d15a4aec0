package com.avocado.bonus_ledger.bonus;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Bonus report for one client: the stored balance next to the balance the ledger
 * explains, per-operation statistics, and the latest entries. Amounts in minor units.
 */
@Value
@Builder
public class ClientBonusSummary {
    Long clientId;
    String firstname;
    String lastname;
    long storedBalance;
    long ledgerBalance;
    List<OperationStatistics> statistics;
    List<BonusLedgerEntry> recentEntries;

    public boolean isConsistent() {
        return storedBalance == ledgerBalance;
    }
}
