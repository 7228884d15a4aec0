package com.avocado.bonus_ledger.bonus;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One immutable bonus balance change. Amounts and balances are in minor units.
 *
 * Key invariant: balanceAfter == balanceBefore + amount, and for one client each
 * entry's balanceBefore equals the previous entry's balanceAfter.
 */
@Value
public class BonusLedgerEntry {
    Long id;
    Long clientId;
    Long transactionId;
    OperationType operationType;
    long amount;
    long balanceBefore;
    long balanceAfter;
    String description;
    BigDecimal bonusPercent;
    BigDecimal transactionSum;
    LocalDateTime processedAt;
    LocalDateTime createdAt;

    /**
     * Creates an entry that is not yet stored, chained on the given balance.
     */
    public static BonusLedgerEntry pending(Long clientId, Long transactionId, OperationType operationType,
                                           long amount, long balanceBefore, String description,
                                           BigDecimal bonusPercent, BigDecimal transactionSum,
                                           LocalDateTime processedAt) {
        if (clientId == null) {
            throw new IllegalArgumentException("Ledger entry requires a client");
        }
        if (operationType == null) {
            throw new IllegalArgumentException("Ledger entry requires an operation type");
        }
        return new BonusLedgerEntry(
            null,
            clientId,
            transactionId,
            operationType,
            amount,
            balanceBefore,
            Math.addExact(balanceBefore, amount),
            description,
            bonusPercent,
            transactionSum,
            processedAt,
            null
        );
    }

    public BonusLedgerEntry withStoredIdentity(Long id, LocalDateTime createdAt) {
        return new BonusLedgerEntry(id, clientId, transactionId, operationType, amount, balanceBefore,
            balanceAfter, description, bonusPercent, transactionSum, processedAt, createdAt);
    }
}
