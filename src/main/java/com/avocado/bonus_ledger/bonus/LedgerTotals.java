package com.avocado.bonus_ledger.bonus;

import lombok.Value;

/**
 * Ledger-wide sums in minor units: positive amounts and absolute negative amounts.
 */
@Value
public class LedgerTotals {
    long earnedTotal;
    long spentTotal;
}
