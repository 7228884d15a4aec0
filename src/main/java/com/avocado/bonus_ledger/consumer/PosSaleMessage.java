package com.avocado.bonus_ledger.consumer;

import com.avocado.bonus_ledger.sales.NewLineItem;
import com.avocado.bonus_ledger.sales.NewSale;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * A sale as published by the point-of-sale sync job on the pos-sales topic.
 * Client profile fields are optional and only used to register unknown clients.
 */
@Value
public class PosSaleMessage {

    public static final String EVENT_TYPE = "PosSaleSynced";

    @JsonProperty("event_id")
    UUID eventId;

    @JsonProperty("event_type")
    String eventType;

    @JsonProperty("transaction_id")
    Long transactionId;

    @JsonProperty("client_id")
    Long clientId;

    @JsonProperty("client_firstname")
    String clientFirstname;

    @JsonProperty("client_lastname")
    String clientLastname;

    @JsonProperty("client_phone")
    String clientPhone;

    @JsonProperty("date_close")
    LocalDateTime dateClose;

    @JsonProperty("sum")
    BigDecimal sum;

    @JsonProperty("paid_sum")
    BigDecimal paidSum;

    @JsonProperty("paid_bonus")
    BigDecimal paidBonus;

    @JsonProperty("bonus_percent")
    BigDecimal bonusPercent;

    @JsonProperty("line_items")
    List<Item> lineItems;

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
            lineItems.forEach(item -> builder.lineItem(
                new NewLineItem(item.getProductId(), item.getProductName(), item.getQuantity(),
                    item.getPrice(), item.getSum())));
        }
        return builder.build();
    }

    @Value
    public static class Item {

        @JsonProperty("product_id")
        Long productId;

        @JsonProperty("product_name")
        String productName;

        @JsonProperty("quantity")
        BigDecimal quantity;

        @JsonProperty("price")
        BigDecimal price;

        @JsonProperty("sum")
        BigDecimal sum;
    }
}
