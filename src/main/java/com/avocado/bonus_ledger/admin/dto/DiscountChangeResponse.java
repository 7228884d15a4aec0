package com.avocado.bonus_ledger.admin.dto;

import com.avocado.bonus_ledger.discount.DiscountChange;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class DiscountChangeResponse {

    @JsonProperty("transaction_id")
    Long transactionId;

    @JsonProperty("old_discount")
    BigDecimal oldDiscount;

    @JsonProperty("new_discount")
    BigDecimal newDiscount;

    @JsonProperty("updated")
    boolean updated;

    public static DiscountChangeResponse from(DiscountChange change) {
        return new DiscountChangeResponse(change.getTransactionId(), change.getOldDiscount(),
            change.getNewDiscount(), change.isUpdated());
    }
}
