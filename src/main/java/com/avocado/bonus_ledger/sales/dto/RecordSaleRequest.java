package com.avocado.bonus_ledger.sales.dto;

import com.avocado.bonus_ledger.sales.NewSale;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Request DTO for recording a closed or open sale from the point of sale.
 */
@Value
public class RecordSaleRequest {

    @NotNull(message = "Transaction ID is required")
    @JsonProperty("transaction_id")
    Long transactionId;

    @JsonProperty("client_id")
    Long clientId;

    @JsonProperty("date_close")
    LocalDateTime dateClose;

    @NotNull(message = "Sum is required")
    @DecimalMin(value = "0.00", message = "Sum must not be negative")
    @JsonProperty("sum")
    BigDecimal sum;

    @DecimalMin(value = "0.00", message = "Paid sum must not be negative")
    @JsonProperty("paid_sum")
    BigDecimal paidSum;

    @DecimalMin(value = "0.00", message = "Paid bonus must not be negative")
    @JsonProperty("paid_bonus")
    BigDecimal paidBonus;

    @DecimalMin(value = "0.00", message = "Bonus percent must not be negative")
    @JsonProperty("bonus_percent")
    BigDecimal bonusPercent;

    @Valid
    @JsonProperty("line_items")
    List<LineItemRequest> lineItems;

    public NewSale toNewSale() {
        NewSale.NewSaleBuilder builder = NewSale.builder()
            .transactionId(transactionId)
            .clientId(clientId)
            .dateClose(dateClose)
            .totalSum(sum)
            .paidSum(paidSum)
            .paidBonus(paidBonus)
            .bonusPercent(bonusPercent);
        if (lineItems != null) {
            lineItems.forEach(item -> builder.lineItem(item.toNewLineItem()));
        }
        return builder.build();
    }
}
