package com.avocado.bonus_ledger.sales.dto;

import com.avocado.bonus_ledger.sales.NewLineItem;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class LineItemRequest {

    @JsonProperty("product_id")
    Long productId;

    @JsonProperty("product_name")
    String productName;

    @DecimalMin(value = "0.000", message = "Quantity must not be negative")
    @JsonProperty("quantity")
    BigDecimal quantity;

    @DecimalMin(value = "0.00", message = "Price must not be negative")
    @JsonProperty("price")
    BigDecimal price;

    @NotNull(message = "Line item sum is required")
    @DecimalMin(value = "0.00", message = "Line item sum must not be negative")
    @JsonProperty("sum")
    BigDecimal sum;

    public NewLineItem toNewLineItem() {
        return new NewLineItem(productId, productName, quantity, price, sum);
    }
}
