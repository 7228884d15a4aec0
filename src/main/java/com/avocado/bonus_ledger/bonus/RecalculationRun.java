package com.avocado.bonus_ledger.bonus;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Progress record of a bulk bonus recalculation.
 *
 * The checkpoint (lastDateClose, lastTransactionId) is the position of the last
 * transaction whose posting has committed; a resumed run continues strictly after it.
 */
@Value
public class RecalculationRun {

    public enum Status {
        IN_PROGRESS,
        COMPLETED,
        FAILED,
        ABANDONED
    }

    Long id;
    Status status;
    long totalTransactions;
    long processedTransactions;
    LocalDateTime lastDateClose;
    Long lastTransactionId;
    String errorMessage;
    LocalDateTime startedAt;
    LocalDateTime updatedAt;
    LocalDateTime finishedAt;

    public boolean hasCheckpoint() {
        return lastDateClose != null && lastTransactionId != null;
    }
}
