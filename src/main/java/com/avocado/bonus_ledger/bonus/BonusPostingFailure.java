package com.avocado.bonus_ledger.bonus;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * A bonus posting that was rolled back while its sale committed.
 * Stays unresolved until a recalculation run rebuilds the ledger.
 */
@Value
public class BonusPostingFailure {
    Long id;
    Long transactionId;
    Long clientId;
    String errorType;
    String errorMessage;
    LocalDateTime failedAt;
    LocalDateTime resolvedAt;

    public boolean isResolved() {
        return resolvedAt != null;
    }
}
