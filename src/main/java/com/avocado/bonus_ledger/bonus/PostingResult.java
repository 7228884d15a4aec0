package com.avocado.bonus_ledger.bonus;

import lombok.Value;

import java.util.List;

/**
 * Outcome of one bonus posting attempt for a sale.
 */
@Value
public class PostingResult {

    public enum SkipReason {
        HOOK_DISABLED,
        PROGRAM_DISABLED,
        NO_CLIENT,
        NOT_CLOSED,
        BEFORE_START_DATE,
        ALREADY_POSTED,
        NOTHING_TO_POST
    }

    Long transactionId;
    SkipReason skipReason;
    List<BonusLedgerEntry> entries;
    Long balanceAfter;

    public static PostingResult posted(Long transactionId, List<BonusLedgerEntry> entries, long balanceAfter) {
        return new PostingResult(transactionId, null, List.copyOf(entries), balanceAfter);
    }

    public static PostingResult skipped(Long transactionId, SkipReason reason) {
        return new PostingResult(transactionId, reason, List.of(), null);
    }

    public boolean isPosted() {
        return skipReason == null;
    }
}
