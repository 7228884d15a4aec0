package com.avocado.bonus_ledger.bonus;

import lombok.Value;

import java.time.LocalDateTime;

@Value
public class OperationStatistics {
    OperationType operationType;
    long count;
    long totalAmount;
    LocalDateTime lastProcessedAt;
}
