package com.avocado.bonus_ledger.sales.event;

import lombok.Value;

/**
 * Published after line items of a sale were added, changed or removed.
 */
@Value
public class LineItemsChangedEvent {
    Long transactionId;
}
