package com.avocado.bonus_ledger.bonus;

import lombok.Value;

/**
 * Result of a bulk bonus recalculation. Totals are in minor units.
 */
@Value
public class BonusRecalculationSummary {
    Long runId;
    long total;
    long updated;
    long earnedTotal;
    long spentTotal;
}
