package com.avocado.bonus_ledger.bonus;

import com.avocado.bonus_ledger.bonus.event.BonusBalanceChangedEvent;
import com.avocado.bonus_ledger.client.ClientService;
import com.avocado.bonus_ledger.observability.BonusMetrics;
import com.avocado.bonus_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Manual corrections of a client's bonus balance by an operator.
 *
 * An adjustment is an ADJUST ledger entry without a transaction, chained on the locked
 * balance like any other entry. Unlike automatic postings, a failed adjustment fails the
 * request.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BonusAdjustmentService {

    private final ClientService clientService;
    private final BonusLedgerService ledgerService;
    private final OutboxService outboxService;
    private final BonusMetrics metrics;

    /**
     * @param amountMinor signed amount in minor units, non-zero
     * @param reason free text shown in the client's history
     * @param adminId operator who made the change
     * @return the stored entry
     */
    @Transactional
    public BonusLedgerEntry adjust(Long clientId, long amountMinor, String reason, String adminId) {
        if (clientId == null) {
            throw new IllegalArgumentException("Client ID cannot be null");
        }
        if (amountMinor == 0) {
            throw new IllegalArgumentException("Adjustment amount must not be zero");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Adjustment reason is required");
        }
        if (adminId == null || adminId.isBlank()) {
            throw new IllegalArgumentException("Admin ID is required");
        }

        long balance = clientService.lockBonusBalance(clientId);
        BonusLedgerEntry entry = ledgerService.append(BonusLedgerEntry.pending(
            clientId,
            null,
            OperationType.ADJUST,
            amountMinor,
            balance,
            "Manual adjustment: " + reason + " (admin: " + adminId + ")",
            null,
            null,
            LocalDateTime.now()
        ));
        clientService.updateBonusBalance(clientId, entry.getBalanceAfter());

        outboxService.saveEvent(
            BonusPostingEngine.AGGREGATE_TYPE,
            clientId.toString(),
            BonusBalanceChangedEvent.EVENT_TYPE,
            BonusBalanceChangedEvent.fromEntries(clientId, null, List.of(entry))
        );
        metrics.recordPosting(OperationType.ADJUST.name(), amountMinor);

        log.info("Bonus adjusted for client {} by admin {}: amount={}, balance {} -> {}",
            clientId, adminId, amountMinor, entry.getBalanceBefore(), entry.getBalanceAfter());
        return entry;
    }
}
