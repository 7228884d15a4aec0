package com.avocado.bonus_ledger.discount;

import com.avocado.bonus_ledger.observability.BonusMetrics;
import com.avocado.bonus_ledger.sales.event.LineItemsChangedEvent;
import com.avocado.bonus_ledger.sales.event.PaymentChangedEvent;
import com.avocado.bonus_ledger.settings.EngineHook;
import com.avocado.bonus_ledger.settings.EngineHookRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DiscountListenerTest {

    @Mock
    private EngineHookRegistry hookRegistry;

    @Mock
    private DiscountReconciliationEngine engine;

    private DiscountListener listener;

    @BeforeEach
    void setUp() {
        listener = new DiscountListener(hookRegistry, engine, new BonusMetrics(new SimpleMeterRegistry()));
    }

    private static PaymentChangedEvent paymentChange(long transactionId) {
        return new PaymentChangedEvent(transactionId,
            new BigDecimal("90.00"), new BigDecimal("10.00"), new BigDecimal("80.00"), new BigDecimal("10.00"));
    }

    @Test
    @DisplayName("Line item change recomputes the discount")
    void lineItemChangeReconciles() {
        when(hookRegistry.isEnabled(EngineHook.DISCOUNT_ON_LINE_ITEMS)).thenReturn(true);

        listener.onLineItemsChanged(new LineItemsChangedEvent(7L));

        verify(engine).reconcile(7L);
    }

    @Test
    @DisplayName("Payment change recomputes the discount")
    void paymentChangeReconciles() {
        when(hookRegistry.isEnabled(EngineHook.DISCOUNT_ON_PAYMENTS)).thenReturn(true);

        listener.onPaymentChanged(paymentChange(8L));

        verify(engine).reconcile(8L);
    }

    @Test
    @DisplayName("Each hook is gated by its own switch")
    void disabledHooksDoNothing() {
        when(hookRegistry.isEnabled(EngineHook.DISCOUNT_ON_LINE_ITEMS)).thenReturn(false);
        when(hookRegistry.isEnabled(EngineHook.DISCOUNT_ON_PAYMENTS)).thenReturn(false);

        listener.onLineItemsChanged(new LineItemsChangedEvent(9L));
        listener.onPaymentChanged(paymentChange(9L));

        verify(engine, never()).reconcile(anyLong());
    }

    @Test
    @DisplayName("Engine failure propagates to the writer")
    void failurePropagates() {
        // Given: the engine cannot reconcile
        when(hookRegistry.isEnabled(EngineHook.DISCOUNT_ON_LINE_ITEMS)).thenReturn(true);
        when(engine.reconcile(10L)).thenThrow(new IllegalStateException("numeric overflow"));

        // When/Then: the exception reaches the caller so the write rolls back
        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> listener.onLineItemsChanged(new LineItemsChangedEvent(10L)));
        assertEquals("numeric overflow", thrown.getMessage());
    }
}
