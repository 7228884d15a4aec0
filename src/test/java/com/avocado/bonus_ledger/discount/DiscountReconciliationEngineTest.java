package com.avocado.bonus_ledger.discount;

import com.avocado.bonus_ledger.sales.LineItem;
import com.avocado.bonus_ledger.sales.NewLineItem;
import com.avocado.bonus_ledger.sales.NewSale;
import com.avocado.bonus_ledger.sales.SaleNotFoundException;
import com.avocado.bonus_ledger.sales.SaleTransaction;
import com.avocado.bonus_ledger.sales.SalesService;
import com.avocado.bonus_ledger.settings.EngineHook;
import com.avocado.bonus_ledger.settings.EngineHookRegistry;
import com.avocado.bonus_ledger.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for discount reconciliation, both through the sales write path
 * and through the operator entry points.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class DiscountReconciliationEngineTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("bonus_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private SalesService salesService;

    @Autowired
    private DiscountControlService controlService;

    @Autowired
    private DiscountReconciliationEngine engine;

    @Autowired
    private EngineHookRegistry hookRegistry;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        TestDatabase.reset(jdbcTemplate);
    }

    private SaleTransaction recordSale(long transactionId, String paidSum, String paidBonus, String... itemSums) {
        NewSale.NewSaleBuilder builder = NewSale.builder()
            .transactionId(transactionId)
            .dateClose(LocalDateTime.of(2025, 10, 5, 14, 0))
            .totalSum(new BigDecimal("100.00"))
            .paidSum(new BigDecimal(paidSum))
            .paidBonus(new BigDecimal(paidBonus));
        for (String itemSum : itemSums) {
            builder.lineItem(NewLineItem.of("Item", new BigDecimal(itemSum)));
        }
        return salesService.recordSale(builder.build(), null, "test");
    }

    @Nested
    @DisplayName("Write path")
    class WritePath {

        @Test
        @DisplayName("Recording a sale with items stores the uncovered part as discount")
        void recordSale_StoresDiscount() {
            SaleTransaction sale = recordSale(8001L, "60.00", "10.00", "50.00", "50.00");

            assertEquals(0, new BigDecimal("30.00").compareTo(sale.getDiscount()));
            assertEquals(0, new BigDecimal("30.00").compareTo(TestDatabase.storedDiscount(jdbcTemplate, 8001L)));
        }

        @Test
        @DisplayName("Adding, changing and removing items keeps the discount current")
        void lineItemChanges_Reconcile() {
            recordSale(8002L, "80.00", "0", "80.00");
            assertEquals(0, BigDecimal.ZERO.compareTo(TestDatabase.storedDiscount(jdbcTemplate, 8002L)));

            LineItem extra = salesService.addLineItem(8002L, NewLineItem.of("Coffee", new BigDecimal("15.00")));
            assertEquals(0, new BigDecimal("15.00").compareTo(TestDatabase.storedDiscount(jdbcTemplate, 8002L)));

            salesService.updateLineItem(8002L, extra.getId(), new BigDecimal("2"), new BigDecimal("30.00"));
            assertEquals(0, new BigDecimal("30.00").compareTo(TestDatabase.storedDiscount(jdbcTemplate, 8002L)));

            salesService.removeLineItem(8002L, extra.getId());
            assertEquals(0, BigDecimal.ZERO.compareTo(TestDatabase.storedDiscount(jdbcTemplate, 8002L)));
        }

        @Test
        @DisplayName("Changing the payment moves the discount, overpayment clamps it at zero")
        void paymentChange_Reconciles() {
            recordSale(8003L, "100.00", "0", "100.00");

            SaleTransaction lowered = salesService.updatePayment(8003L, new BigDecimal("70.00"), new BigDecimal("5.00"));
            assertEquals(0, new BigDecimal("25.00").compareTo(lowered.getDiscount()));

            SaleTransaction overpaid = salesService.updatePayment(8003L, new BigDecimal("150.00"), new BigDecimal("5.00"));
            assertEquals(0, BigDecimal.ZERO.compareTo(overpaid.getDiscount()));
        }

        @Test
        @DisplayName("Disabled line item hook leaves the discount stale")
        void disabledHook_LeavesDiscount() {
            recordSale(8004L, "50.00", "0", "50.00");
            hookRegistry.disable(EngineHook.DISCOUNT_ON_LINE_ITEMS);

            salesService.addLineItem(8004L, NewLineItem.of("Cake", new BigDecimal("20.00")));

            assertEquals(0, BigDecimal.ZERO.compareTo(TestDatabase.storedDiscount(jdbcTemplate, 8004L)));
            assertEquals(0, new BigDecimal("20.00").compareTo(controlService.calculateDiscount(8004L)));
        }
    }

    @Nested
    @DisplayName("Operator entry points")
    class OperatorEntryPoints {

        @Test
        @DisplayName("Trigger switch reports its new state")
        void manageTriggers_ReportsState() {
            assertEquals("Discount triggers DISABLED", controlService.manageDiscountTriggers(false));
            assertFalse(hookRegistry.isEnabled(EngineHook.DISCOUNT_ON_LINE_ITEMS));
            assertFalse(hookRegistry.isEnabled(EngineHook.DISCOUNT_ON_PAYMENTS));

            assertEquals("Discount triggers ENABLED", controlService.manageDiscountTriggers(true));
            assertTrue(hookRegistry.isEnabled(EngineHook.DISCOUNT_ON_LINE_ITEMS));
            assertTrue(hookRegistry.isEnabled(EngineHook.DISCOUNT_ON_PAYMENTS));
        }

        @Test
        @DisplayName("Preview of a sale without items is zero, of an unknown sale is an error")
        void calculateDiscount_EdgeCases() {
            recordSale(8101L, "10.00", "0");

            assertEquals(0, BigDecimal.ZERO.compareTo(controlService.calculateDiscount(8101L)));
            assertThrows(SaleNotFoundException.class, () -> controlService.calculateDiscount(999999L));
        }

        @Test
        @DisplayName("Full recalculation repairs drifted discounts and reports totals")
        void recalculateAll_RepairsDrift() {
            // Given: three sales, two of them with drifted discounts written behind the engine's back
            recordSale(8201L, "40.00", "0", "50.00");
            recordSale(8202L, "10.00", "0", "100.00");
            recordSale(8203L, "0", "0");
            jdbcTemplate.update("UPDATE transactions SET discount = 777 WHERE transaction_id IN (8201, 8202)");

            // When
            DiscountRecalculationSummary summary = controlService.recalculateAllDiscountsWithTrigger();

            // Then: only sales with items are touched
            assertEquals(3L, summary.getTotal());
            assertEquals(2L, summary.getUpdated());
            assertEquals(0, new BigDecimal("100.00").compareTo(summary.getDiscountTotal()));
            assertEquals(0, new BigDecimal("10.00").compareTo(TestDatabase.storedDiscount(jdbcTemplate, 8201L)));
            assertEquals(0, new BigDecimal("90.00").compareTo(TestDatabase.storedDiscount(jdbcTemplate, 8202L)));
            assertTrue(hookRegistry.isEnabled(EngineHook.DISCOUNT_ON_PAYMENTS));
        }

        @Test
        @DisplayName("Batch recalculation returns old and new discount per sale with items")
        void recalculateBatch_ReturnsChanges() {
            recordSale(8301L, "30.00", "0", "50.00");
            recordSale(8302L, "0", "0");
            jdbcTemplate.update("UPDATE transactions SET discount = 5 WHERE transaction_id = 8301");

            List<DiscountChange> changes = controlService.recalculateDiscounts(List.of(8302L, 8301L, 8301L, 424242L));

            assertEquals(1, changes.size());
            DiscountChange change = changes.get(0);
            assertEquals(8301L, change.getTransactionId());
            assertEquals(0, new BigDecimal("5.00").compareTo(change.getOldDiscount()));
            assertEquals(0, new BigDecimal("20.00").compareTo(change.getNewDiscount()));
            assertTrue(change.isUpdated());
        }

        @Test
        @DisplayName("Batch recalculation rejects empty and oversized input")
        void recalculateBatch_ValidatesSize() {
            assertThrows(IllegalArgumentException.class, () -> controlService.recalculateDiscounts(List.of()));
            assertThrows(IllegalArgumentException.class,
                () -> controlService.recalculateDiscounts(Collections.nCopies(1001, 1L)));
        }

        @Test
        @DisplayName("No discount is ever negative after a full recalculation")
        void discounts_AreNeverNegative() {
            recordSale(8401L, "500.00", "50.00", "10.00");
            recordSale(8402L, "0", "0", "0.01");

            engine.reconcileAll();

            Integer negative = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM transactions WHERE discount < 0", Integer.class);
            assertEquals(0, negative);
            assertEquals(0, new BigDecimal("0.01").compareTo(TestDatabase.storedDiscount(jdbcTemplate, 8402L)));
        }
    }
}
