package com.avocado.bonus_ledger.discount;

import com.avocado.bonus_ledger.observability.BonusMetrics;
import com.avocado.bonus_ledger.settings.EngineHook;
import com.avocado.bonus_ledger.settings.EngineHookRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Operator entry points of the discount engine.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DiscountControlService {

    static final int MAX_BATCH_SIZE = 1000;

    private final EngineHookRegistry hookRegistry;
    private final DiscountReconciliationEngine engine;
    private final BonusMetrics metrics;

    /**
     * Switches both discount hooks.
     */
    @Transactional
    public String manageDiscountTriggers(boolean enable) {
        if (enable) {
            hookRegistry.enable(EngineHook.DISCOUNT_ON_LINE_ITEMS);
            hookRegistry.enable(EngineHook.DISCOUNT_ON_PAYMENTS);
            return "Discount triggers ENABLED";
        }
        hookRegistry.disable(EngineHook.DISCOUNT_ON_LINE_ITEMS);
        hookRegistry.disable(EngineHook.DISCOUNT_ON_PAYMENTS);
        return "Discount triggers DISABLED";
    }

    /**
     * Recomputes every discount in one statement. The payment hook is switched off for
     * the duration and switched on again afterwards.
     */
    @Transactional
    public DiscountRecalculationSummary recalculateAllDiscountsWithTrigger() {
        Instant started = Instant.now();

        hookRegistry.disable(EngineHook.DISCOUNT_ON_PAYMENTS);
        int updated = engine.reconcileAll();
        hookRegistry.enable(EngineHook.DISCOUNT_ON_PAYMENTS);

        DiscountRecalculationSummary summary = new DiscountRecalculationSummary(
            engine.countTransactions(),
            updated,
            engine.sumPositiveDiscounts()
        );

        metrics.recordRecalculationDuration("discount", Duration.between(started, Instant.now()));
        log.info("Discounts recalculated: total={}, updated={}, discountTotal={}",
            summary.getTotal(), summary.getUpdated(), summary.getDiscountTotal());
        return summary;
    }

    @Transactional(readOnly = true)
    public BigDecimal calculateDiscount(Long transactionId) {
        return engine.calculateDiscount(transactionId);
    }

    @Transactional
    public List<DiscountChange> recalculateDiscounts(List<Long> transactionIds) {
        if (transactionIds == null || transactionIds.isEmpty()) {
            throw new IllegalArgumentException("At least one transaction ID is required");
        }
        if (transactionIds.size() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("At most " + MAX_BATCH_SIZE + " transactions per batch");
        }
        List<DiscountChange> changes = engine.reconcileBatch(transactionIds.stream().distinct().toList());
        changes.forEach(change -> metrics.recordDiscountRecalculated("batch"));
        return changes;
    }
}
