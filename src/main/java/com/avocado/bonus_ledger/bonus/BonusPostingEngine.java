package com.avocado.bonus_ledger.bonus;

import com.avocado.bonus_ledger.bonus.PostingResult.SkipReason;
import com.avocado.bonus_ledger.bonus.event.BonusBalanceChangedEvent;
import com.avocado.bonus_ledger.client.ClientService;
import com.avocado.bonus_ledger.observability.BonusMetrics;
import com.avocado.bonus_ledger.outbox.OutboxService;
import com.avocado.bonus_ledger.sales.SaleTransaction;
import com.avocado.bonus_ledger.settings.BonusSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a closed sale into SPEND and EARN ledger entries and moves the client's balance.
 *
 * Eligibility: the sale has a client and a close time, closed on or after the program
 * start date, and has no ledger entries yet. The client row is locked before the
 * balance is read, SPEND is written before EARN, and the stored balance is updated
 * only when at least one entry was written.
 *
 * Runs in the caller's transaction. For automatic postings that transaction is held
 * behind a savepoint by {@link BonusPostingListener}; nothing here may cross a
 * {@code @Transactional} proxy that can throw before the outbox write, which is last.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BonusPostingEngine {

    public static final String AGGREGATE_TYPE = "ClientBonus";

    private final BonusLedgerService ledgerService;
    private final ClientService clientService;
    private final OutboxService outboxService;
    private final BonusMetrics metrics;

    /**
     * Posts a sale that has just been recorded. Nothing happens while the program is disabled.
     */
    public PostingResult postRecordedSale(SaleTransaction sale, BonusSettings settings) {
        if (!settings.isEnabled()) {
            return skip(sale, SkipReason.PROGRAM_DISABLED);
        }
        return postIfEligible(sale, settings, true);
    }

    /**
     * Posts a sale during a ledger rebuild. The program flag is not consulted; the
     * start date still applies. No balance notification is queued for the client.
     */
    public PostingResult postForRecalculation(SaleTransaction sale, BonusSettings settings) {
        return postIfEligible(sale, settings, false);
    }

    private PostingResult postIfEligible(SaleTransaction sale, BonusSettings settings, boolean notifyClient) {
        if (sale.getClientId() == null) {
            return skip(sale, SkipReason.NO_CLIENT);
        }
        if (sale.getDateClose() == null) {
            return skip(sale, SkipReason.NOT_CLOSED);
        }
        if (!settings.coversCloseDate(sale.getDateClose())) {
            return skip(sale, SkipReason.BEFORE_START_DATE);
        }
        if (ledgerService.hasEntriesForTransaction(sale.getTransactionId())) {
            return skip(sale, SkipReason.ALREADY_POSTED);
        }

        BonusCalculation calculation = BonusCalculation.of(
            sale.getTotalSum(), sale.getBonusPercent(), sale.getPaidBonus());
        if (!calculation.hasEarning() && !calculation.hasSpending()) {
            return skip(sale, SkipReason.NOTHING_TO_POST);
        }

        return metrics.timePosting(() -> post(sale, calculation, notifyClient));
    }

    private PostingResult post(SaleTransaction sale, BonusCalculation calculation, boolean notifyClient) {
        Long clientId = sale.getClientId();
        Long transactionId = sale.getTransactionId();

        long balance = clientService.lockBonusBalance(clientId);
        List<BonusLedgerEntry> written = new ArrayList<>(2);

        if (calculation.hasSpending()) {
            BonusLedgerEntry spend = ledgerService.append(BonusLedgerEntry.pending(
                clientId,
                transactionId,
                OperationType.SPEND,
                -calculation.getSpentMinor(),
                balance,
                "Bonus payment for transaction #" + transactionId,
                null,
                null,
                sale.getDateClose()
            ));
            balance = spend.getBalanceAfter();
            written.add(spend);
        }

        if (calculation.hasEarning()) {
            BonusLedgerEntry earn = ledgerService.append(BonusLedgerEntry.pending(
                clientId,
                transactionId,
                OperationType.EARN,
                calculation.getEarnedMinor(),
                balance,
                "Accrued " + sale.getBonusPercent().toPlainString() + "% bonus for transaction #" + transactionId,
                sale.getBonusPercent(),
                sale.getTotalSum(),
                sale.getDateClose()
            ));
            balance = earn.getBalanceAfter();
            written.add(earn);
        }

        clientService.updateBonusBalance(clientId, balance);

        for (BonusLedgerEntry entry : written) {
            metrics.recordPosting(entry.getOperationType().name(), entry.getAmount());
        }

        if (notifyClient) {
            outboxService.saveEvent(
                AGGREGATE_TYPE,
                clientId.toString(),
                BonusBalanceChangedEvent.EVENT_TYPE,
                BonusBalanceChangedEvent.fromEntries(clientId, transactionId, written)
            );
        }

        log.info("Posted bonus for transaction {}: client={}, earned={}, spent={}, balanceAfter={}",
            transactionId, clientId, calculation.getEarned(), calculation.getSpent(), MinorUnits.toMajor(balance));

        return PostingResult.posted(transactionId, written, balance);
    }

    private PostingResult skip(SaleTransaction sale, SkipReason reason) {
        log.debug("Bonus posting skipped for transaction {}: {}", sale.getTransactionId(), reason);
        metrics.recordPostingSkipped(reason.name());
        return PostingResult.skipped(sale.getTransactionId(), reason);
    }
}
