package com.avocado.bonus_ledger.bonus;

import com.avocado.bonus_ledger.observability.BonusMetrics;
import com.avocado.bonus_ledger.observability.CorrelationContext;
import com.avocado.bonus_ledger.sales.SaleTransaction;
import com.avocado.bonus_ledger.sales.event.SaleWrittenEvent;
import com.avocado.bonus_ledger.settings.BonusSettings;
import com.avocado.bonus_ledger.settings.EngineHook;
import com.avocado.bonus_ledger.settings.EngineHookRegistry;
import com.avocado.bonus_ledger.settings.SettingsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Posts bonus for a sale right after it is first recorded, inside the same transaction.
 *
 * Fail-open: the posting runs behind a savepoint. If it fails, its partial writes are
 * rolled back, the failure is logged and dead-lettered, and the sale write still
 * commits. Updates of an existing sale never post bonus.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BonusPostingListener {

    private final EngineHookRegistry hookRegistry;
    private final SettingsService settingsService;
    private final BonusPostingEngine postingEngine;
    private final SavepointExecutor savepoints;
    private final BonusPostingFailureRecorder failureRecorder;
    private final BonusMetrics metrics;

    @EventListener
    public void onSaleWritten(SaleWrittenEvent event) {
        if (!event.isInsert()) {
            return;
        }

        SaleTransaction sale = event.getTransaction();
        // the caller may have tagged its own work; put its values back afterwards
        String outerTransactionId = MDC.get(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        String outerClientId = MDC.get(CorrelationContext.CLIENT_ID_MDC_KEY);
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, String.valueOf(sale.getTransactionId()));
        if (sale.getClientId() != null) {
            MDC.put(CorrelationContext.CLIENT_ID_MDC_KEY, sale.getClientId().toString());
        }

        try {
            PostingResult result = savepoints.callIsolated(() -> post(sale));
            log.debug("Bonus posting for transaction {} finished: posted={}, skipReason={}",
                sale.getTransactionId(), result.isPosted(), result.getSkipReason());
        } catch (RuntimeException e) {
            handleFailure(sale, e);
        } finally {
            restore(CorrelationContext.TRANSACTION_ID_MDC_KEY, outerTransactionId);
            restore(CorrelationContext.CLIENT_ID_MDC_KEY, outerClientId);
        }
    }

    private static void restore(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private PostingResult post(SaleTransaction sale) {
        if (!hookRegistry.isEnabled(EngineHook.BONUS_POSTING)) {
            metrics.recordPostingSkipped(PostingResult.SkipReason.HOOK_DISABLED.name());
            return PostingResult.skipped(sale.getTransactionId(), PostingResult.SkipReason.HOOK_DISABLED);
        }
        BonusSettings settings = settingsService.loadBonusSettings();
        return postingEngine.postRecordedSale(sale, settings);
    }

    private void handleFailure(SaleTransaction sale, RuntimeException error) {
        log.error("Bonus posting failed for transaction {} (client {}), sale is kept without bonus",
            sale.getTransactionId(), sale.getClientId(), error);
        metrics.recordPostingFailure(error.getClass().getSimpleName());

        try {
            savepoints.runIsolated(() ->
                failureRecorder.record(sale.getTransactionId(), sale.getClientId(), error));
        } catch (RuntimeException recordingError) {
            log.error("Could not record bonus posting failure for transaction {}",
                sale.getTransactionId(), recordingError);
        }
    }
}
