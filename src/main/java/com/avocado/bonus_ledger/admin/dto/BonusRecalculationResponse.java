package com.avocado.bonus_ledger.admin.dto;

import com.avocado.bonus_ledger.bonus.BonusRecalculationSummary;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * Totals are in minor units.
 */
@Value
@Builder
public class BonusRecalculationResponse {

    @JsonProperty("run_id")
    Long runId;

    @JsonProperty("total")
    long total;

    @JsonProperty("updated")
    long updated;

    @JsonProperty("earned_total")
    long earnedTotal;

    @JsonProperty("spent_total")
    long spentTotal;

    public static BonusRecalculationResponse from(BonusRecalculationSummary summary) {
        return BonusRecalculationResponse.builder()
            .runId(summary.getRunId())
            .total(summary.getTotal())
            .updated(summary.getUpdated())
            .earnedTotal(summary.getEarnedTotal())
            .spentTotal(summary.getSpentTotal())
            .build();
    }
}
