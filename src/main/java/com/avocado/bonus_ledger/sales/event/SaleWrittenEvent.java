package com.avocado.bonus_ledger.sales.event;

import com.avocado.bonus_ledger.sales.SaleTransaction;
import lombok.Value;

/**
 * Published inside the writing transaction after a sale row is inserted or updated.
 * Listeners run synchronously in the same transaction.
 */
@Value
public class SaleWrittenEvent {

    public enum WriteKind {
        INSERT,
        UPDATE
    }

    SaleTransaction transaction;
    WriteKind writeKind;

    public static SaleWrittenEvent inserted(SaleTransaction transaction) {
        return new SaleWrittenEvent(transaction, WriteKind.INSERT);
    }

    public static SaleWrittenEvent updated(SaleTransaction transaction) {
        return new SaleWrittenEvent(transaction, WriteKind.UPDATE);
    }

    public boolean isInsert() {
        return writeKind == WriteKind.INSERT;
    }
}
