package com.avocado.bonus_ledger.bonus.event;

import com.avocado.bonus_ledger.bonus.BonusLedgerEntry;
import com.avocado.bonus_ledger.bonus.OperationType;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published through the outbox whenever a client's bonus balance changes,
 * so the Telegram bot can notify the client.
 *
 * All amounts are in minor units. earned and spent are non-negative; adjusted is signed.
 */
@Value
public class BonusBalanceChangedEvent {

    public static final String EVENT_TYPE = "BonusBalanceChanged";

    UUID eventId;
    Long clientId;
    Long transactionId;
    long earned;
    long spent;
    long adjusted;
    long balanceAfter;
    Instant occurredAt;

    public String getEventType() {
        return EVENT_TYPE;
    }

    /**
     * Summarises entries just written for one client. The entries must be in posting order.
     */
    public static BonusBalanceChangedEvent fromEntries(Long clientId, Long transactionId,
                                                       List<BonusLedgerEntry> entries) {
        if (entries.isEmpty()) {
            throw new IllegalArgumentException("Balance change requires at least one ledger entry");
        }
        long earned = 0;
        long spent = 0;
        long adjusted = 0;
        for (BonusLedgerEntry entry : entries) {
            if (entry.getOperationType() == OperationType.EARN) {
                earned += entry.getAmount();
            } else if (entry.getOperationType() == OperationType.SPEND) {
                spent += -entry.getAmount();
            } else {
                adjusted += entry.getAmount();
            }
        }
        return new BonusBalanceChangedEvent(
            UUID.randomUUID(),
            clientId,
            transactionId,
            earned,
            spent,
            adjusted,
            entries.get(entries.size() - 1).getBalanceAfter(),
            Instant.now()
        );
    }
}
