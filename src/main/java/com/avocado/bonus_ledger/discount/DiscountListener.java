package com.avocado.bonus_ledger.discount;

import com.avocado.bonus_ledger.observability.BonusMetrics;
import com.avocado.bonus_ledger.sales.event.LineItemsChangedEvent;
import com.avocado.bonus_ledger.sales.event.PaymentChangedEvent;
import com.avocado.bonus_ledger.settings.EngineHook;
import com.avocado.bonus_ledger.settings.EngineHookRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Recomputes a sale's discount whenever its line items or paid amounts change.
 *
 * Fail-closed: exceptions are not caught, so a failed recomputation rolls back the
 * write that triggered it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DiscountListener {

    private final EngineHookRegistry hookRegistry;
    private final DiscountReconciliationEngine engine;
    private final BonusMetrics metrics;

    @EventListener
    public void onLineItemsChanged(LineItemsChangedEvent event) {
        if (!hookRegistry.isEnabled(EngineHook.DISCOUNT_ON_LINE_ITEMS)) {
            log.debug("Discount hook for line items is disabled, transaction {} left as is",
                event.getTransactionId());
            return;
        }
        engine.reconcile(event.getTransactionId());
        metrics.recordDiscountRecalculated("line_items");
    }

    @EventListener
    public void onPaymentChanged(PaymentChangedEvent event) {
        if (!hookRegistry.isEnabled(EngineHook.DISCOUNT_ON_PAYMENTS)) {
            log.debug("Discount hook for payments is disabled, transaction {} left as is",
                event.getTransactionId());
            return;
        }
        engine.reconcile(event.getTransactionId());
        metrics.recordDiscountRecalculated("payment");
    }
}
