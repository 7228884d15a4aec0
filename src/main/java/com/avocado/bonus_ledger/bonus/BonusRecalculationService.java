package com.avocado.bonus_ledger.bonus;

import com.avocado.bonus_ledger.client.ClientService;
import com.avocado.bonus_ledger.observability.BonusMetrics;
import com.avocado.bonus_ledger.sales.SaleTransaction;
import com.avocado.bonus_ledger.settings.BonusSettings;
import com.avocado.bonus_ledger.settings.EngineHook;
import com.avocado.bonus_ledger.settings.EngineHookRegistry;
import com.avocado.bonus_ledger.settings.SettingsService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Rebuilds the bonus ledger from the sales history.
 *
 * A fresh run wipes the ledger, zeroes every balance and disables the automatic
 * posting hook in one transaction. Eligible sales (client and close time set, closed
 * on or after the start date) are then replayed in (date_close, transaction_id) order,
 * one batch per transaction, each batch advancing the run's checkpoint. When the last
 * batch commits the hook is enabled again and open posting failures are resolved.
 *
 * If a batch fails the run is marked FAILED and the hook stays disabled, so live sales
 * do not post onto a half-built ledger. {@link #resume()} continues after the checkpoint.
 *
 * Methods here manage their own transactions and must not be called inside one.
 */
@Service
@Slf4j
public class BonusRecalculationService {

    private static final int PROGRESS_LOG_INTERVAL = 1000;

    private static final String SALE_COLUMNS =
        "transaction_id, client_id, date_close, sum, paid_sum, paid_bonus, bonus_percent, discount, " +
        "created_at, updated_at";

    private static final String ELIGIBLE =
        "client_id IS NOT NULL AND date_close IS NOT NULL AND date_close >= ?";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final BonusLedgerService ledgerService;
    private final ClientService clientService;
    private final SettingsService settingsService;
    private final EngineHookRegistry hookRegistry;
    private final BonusPostingEngine postingEngine;
    private final BonusPostingFailureRecorder failureRecorder;
    private final RecalculationRunStore runStore;
    private final BonusMetrics metrics;
    private final int batchSize;

    public BonusRecalculationService(JdbcTemplate jdbcTemplate,
                                     PlatformTransactionManager transactionManager,
                                     BonusLedgerService ledgerService,
                                     ClientService clientService,
                                     SettingsService settingsService,
                                     EngineHookRegistry hookRegistry,
                                     BonusPostingEngine postingEngine,
                                     BonusPostingFailureRecorder failureRecorder,
                                     RecalculationRunStore runStore,
                                     BonusMetrics metrics,
                                     @Value("${bonus.recalculation.batch-size:500}") int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("bonus.recalculation.batch-size must be positive: " + batchSize);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.ledgerService = ledgerService;
        this.clientService = clientService;
        this.settingsService = settingsService;
        this.hookRegistry = hookRegistry;
        this.postingEngine = postingEngine;
        this.failureRecorder = failureRecorder;
        this.runStore = runStore;
        this.metrics = metrics;
        this.batchSize = batchSize;
    }

    /**
     * Starts a fresh recalculation. Any unfinished earlier run is abandoned.
     */
    public BonusRecalculationSummary recalculateAll() {
        Instant started = Instant.now();
        BonusSettings settings = settingsService.loadBonusSettings();

        RecalculationRun run = transactionTemplate.execute(status -> {
            int abandoned = runStore.abandonUnfinished();
            if (abandoned > 0) {
                log.warn("Abandoned {} unfinished bonus recalculation run(s)", abandoned);
            }
            hookRegistry.disable(EngineHook.BONUS_POSTING);
            ledgerService.deleteAll();
            clientService.resetAllBonusBalances();
            return runStore.start(countEligible(settings));
        });

        log.info("Bonus recalculation run {} started: {} eligible transactions since {}",
            run.getId(), run.getTotalTransactions(), settings.getStartDate());

        return processRemaining(run, settings, started);
    }

    /**
     * Continues the latest unfinished run from its checkpoint, without wiping the ledger.
     *
     * @throws IllegalStateException if there is no unfinished run
     */
    public BonusRecalculationSummary resume() {
        Instant started = Instant.now();
        BonusSettings settings = settingsService.loadBonusSettings();

        RecalculationRun run = transactionTemplate.execute(status -> {
            RecalculationRun resumable = runStore.findResumable()
                .orElseThrow(() -> new IllegalStateException("No unfinished bonus recalculation to resume"));
            hookRegistry.disable(EngineHook.BONUS_POSTING);
            runStore.markInProgress(resumable.getId());
            return resumable;
        });

        log.info("Resuming bonus recalculation run {} after transaction {} ({}/{} processed)",
            run.getId(), run.getLastTransactionId(), run.getProcessedTransactions(), run.getTotalTransactions());

        return processRemaining(run, settings, started);
    }

    private BonusRecalculationSummary processRemaining(RecalculationRun run, BonusSettings settings, Instant started) {
        RecalculationRun current = run;
        try {
            while (true) {
                RecalculationRun checkpoint = current;
                RecalculationRun next = transactionTemplate.execute(status -> processBatch(checkpoint, settings));
                if (next == null) {
                    break;
                }
                logProgress(current, next);
                current = next;
            }
        } catch (RuntimeException e) {
            markFailed(current, e);
            throw e;
        }

        RecalculationRun finished = current;
        BonusRecalculationSummary summary = transactionTemplate.execute(status -> {
            hookRegistry.enable(EngineHook.BONUS_POSTING);
            failureRecorder.resolveAll();
            runStore.markCompleted(finished.getId());
            LedgerTotals totals = ledgerService.totals();
            return new BonusRecalculationSummary(
                finished.getId(),
                finished.getTotalTransactions(),
                finished.getProcessedTransactions(),
                totals.getEarnedTotal(),
                totals.getSpentTotal()
            );
        });

        Duration duration = Duration.between(started, Instant.now());
        metrics.recordRecalculationDuration("bonus", duration);
        log.info("Bonus recalculation run {} completed in {} ms: total={}, updated={}, earned={}, spent={}",
            summary.getRunId(), duration.toMillis(), summary.getTotal(), summary.getUpdated(),
            summary.getEarnedTotal(), summary.getSpentTotal());
        return summary;
    }

    /**
     * Posts the next batch after the checkpoint and advances it.
     *
     * @return the advanced run, or null when nothing is left
     */
    private RecalculationRun processBatch(RecalculationRun run, BonusSettings settings) {
        List<SaleTransaction> batch = nextBatch(run, settings);
        if (batch.isEmpty()) {
            return null;
        }

        for (SaleTransaction sale : batch) {
            postingEngine.postForRecalculation(sale, settings);
        }

        SaleTransaction last = batch.get(batch.size() - 1);
        runStore.advance(run.getId(), batch.size(), last.getDateClose(), last.getTransactionId());
        return runStore.findById(run.getId()).orElseThrow();
    }

    private List<SaleTransaction> nextBatch(RecalculationRun run, BonusSettings settings) {
        Timestamp startOfWindow = Timestamp.valueOf(settings.getStartDate().atStartOfDay());
        if (!run.hasCheckpoint()) {
            return jdbcTemplate.query(
                "SELECT " + SALE_COLUMNS + " FROM transactions WHERE " + ELIGIBLE +
                " ORDER BY date_close, transaction_id LIMIT ?",
                saleRowMapper(),
                startOfWindow,
                batchSize
            );
        }
        return jdbcTemplate.query(
            "SELECT " + SALE_COLUMNS + " FROM transactions WHERE " + ELIGIBLE +
            " AND (date_close, transaction_id) > (?, ?) ORDER BY date_close, transaction_id LIMIT ?",
            saleRowMapper(),
            startOfWindow,
            Timestamp.valueOf(run.getLastDateClose()),
            run.getLastTransactionId(),
            batchSize
        );
    }

    private long countEligible(BonusSettings settings) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transactions WHERE " + ELIGIBLE,
            Long.class,
            Timestamp.valueOf(settings.getStartDate().atStartOfDay())
        );
        return count != null ? count : 0L;
    }

    private void markFailed(RecalculationRun run, RuntimeException error) {
        log.error("Bonus recalculation run {} failed after {} transactions; posting hook left disabled",
            run.getId(), run.getProcessedTransactions(), error);
        try {
            transactionTemplate.executeWithoutResult(status -> runStore.markFailed(run.getId(), error.getMessage()));
        } catch (RuntimeException markError) {
            error.addSuppressed(markError);
        }
    }

    private void logProgress(RecalculationRun before, RecalculationRun after) {
        if (after.getProcessedTransactions() / PROGRESS_LOG_INTERVAL
                > before.getProcessedTransactions() / PROGRESS_LOG_INTERVAL) {
            log.info("Bonus recalculation run {}: processed {}/{} transactions",
                after.getId(), after.getProcessedTransactions(), after.getTotalTransactions());
        }
    }

    private static RowMapper<SaleTransaction> saleRowMapper() {
        return (rs, rowNum) -> new SaleTransaction(
            rs.getLong("transaction_id"),
            rs.getObject("client_id", Long.class),
            rs.getTimestamp("date_close").toLocalDateTime(),
            rs.getBigDecimal("sum"),
            rs.getBigDecimal("paid_sum"),
            rs.getBigDecimal("paid_bonus"),
            rs.getBigDecimal("bonus_percent"),
            rs.getBigDecimal("discount"),
            toLocalDateTime(rs.getTimestamp("created_at")),
            toLocalDateTime(rs.getTimestamp("updated_at"))
        );
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }
}
