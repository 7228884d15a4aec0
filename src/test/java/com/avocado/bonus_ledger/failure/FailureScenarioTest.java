package com.avocado.bonus_ledger.failure;

import com.avocado.bonus_ledger.bonus.BonusControlService;
import com.avocado.bonus_ledger.bonus.BonusLedgerService;
import com.avocado.bonus_ledger.bonus.BonusPostingFailure;
import com.avocado.bonus_ledger.bonus.BonusPostingFailureRecorder;
import com.avocado.bonus_ledger.bonus.event.BonusBalanceChangedEvent;
import com.avocado.bonus_ledger.client.ClientService;
import com.avocado.bonus_ledger.discount.DiscountReconciliationEngine;
import com.avocado.bonus_ledger.outbox.OutboxEvent;
import com.avocado.bonus_ledger.outbox.OutboxService;
import com.avocado.bonus_ledger.sales.IdempotencyService;
import com.avocado.bonus_ledger.sales.NewLineItem;
import com.avocado.bonus_ledger.sales.NewSale;
import com.avocado.bonus_ledger.sales.SalesService;
import com.avocado.bonus_ledger.support.TestDatabase;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

/**
 * Failure scenarios of the write path.
 *
 * A broken bonus posting must never cost the sale: the sale commits, the posting leaves
 * nothing behind and the failure is recorded for the next rebuild. A broken discount
 * reconciliation, on the other hand, rolls the whole write back.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class FailureScenarioTest {

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
        // Kafka is unreachable and the publisher stays off
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private SalesService salesService;

    @Autowired
    private BonusLedgerService ledgerService;

    @Autowired
    private BonusPostingFailureRecorder failureRecorder;

    @Autowired
    private BonusControlService bonusControlService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private IdempotencyService idempotencyService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @SpyBean
    private ClientService clientService;

    @SpyBean
    private DiscountReconciliationEngine discountEngine;

    @SpyBean
    private ObjectMapper objectMapper;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    private static final long CLIENT_ID = 21L;
    private static final LocalDateTime CLOSED_AT = LocalDateTime.of(2025, 9, 20, 18, 30);

    @BeforeEach
    void setUp() {
        TestDatabase.reset(jdbcTemplate);
        TestDatabase.insertClient(jdbcTemplate, CLIENT_ID);
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("FAILURE SCENARIO: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ VERIFIED: " + message);
    }

    private NewSale.NewSaleBuilder sale(long transactionId, Long clientId) {
        return NewSale.builder()
            .transactionId(transactionId)
            .clientId(clientId)
            .dateClose(CLOSED_AT)
            .totalSum(new BigDecimal("100.00"))
            .paidSum(new BigDecimal("90.00"))
            .paidBonus(new BigDecimal("10.00"))
            .bonusPercent(new BigDecimal("5"));
    }

    @Nested
    @DisplayName("1. Bonus posting fails open")
    class PostingFailures {

        @Test
        @DisplayName("1.1 Sale commits when the balance update fails, nothing is posted")
        void balanceUpdateFailure_SaleCommits() {
            printTestHeader("Balance update fails during posting");

            // Given
            doThrow(new DataAccessResourceFailureException("balance store unavailable"))
                .when(clientService).updateBonusBalance(anyLong(), anyLong());

            // When
            assertDoesNotThrow(() -> salesService.recordSale(sale(8001L, CLIENT_ID).build(), null, "api"));

            // Then
            assertTrue(salesService.findSale(8001L).isPresent());
            assertTrue(ledgerService.findByTransaction(8001L).isEmpty(),
                "Entries written before the failure are rolled back with the posting");
            assertEquals(0L, TestDatabase.storedBalance(jdbcTemplate, CLIENT_ID));
            assertEquals(0L, outboxService.countUnpublished());
            printSuccess("Sale committed without a partial posting");

            List<BonusPostingFailure> failures = failureRecorder.findUnresolved(10);
            assertEquals(1, failures.size());
            assertEquals(8001L, failures.get(0).getTransactionId());
            assertEquals(CLIENT_ID, failures.get(0).getClientId());
            assertEquals("DataAccessResourceFailureException", failures.get(0).getErrorType());
            assertEquals("balance store unavailable", failures.get(0).getErrorMessage());
            printSuccess("Failure recorded for repair");
        }

        @Test
        @DisplayName("1.2 Rebuild repairs a failed posting and resolves the failure")
        void rebuildRepairsFailedPosting() {
            printTestHeader("Rebuild after a failed posting");

            // Given
            doThrow(new DataAccessResourceFailureException("balance store unavailable"))
                .when(clientService).updateBonusBalance(anyLong(), anyLong());
            salesService.recordSale(sale(8002L, CLIENT_ID).build(), null, "api");
            assertEquals(1L, failureRecorder.countUnresolved());

            // When
            doCallRealMethod().when(clientService).updateBonusBalance(anyLong(), anyLong());
            bonusControlService.recalculateAllBonusesWithTrigger();

            // Then
            assertEquals(2, ledgerService.findByTransaction(8002L).size());
            assertEquals(-500L, TestDatabase.storedBalance(jdbcTemplate, CLIENT_ID));
            assertEquals(0L, failureRecorder.countUnresolved());
            printSuccess("Ledger rebuilt and failure resolved");
        }

        @Test
        @DisplayName("1.3 Later sales of the client post normally after a failure")
        void laterSalesPostNormally() {
            // Given
            doThrow(new DataAccessResourceFailureException("balance store unavailable"))
                .when(clientService).updateBonusBalance(anyLong(), anyLong());
            salesService.recordSale(sale(8003L, CLIENT_ID).build(), null, "api");

            // When
            doCallRealMethod().when(clientService).updateBonusBalance(anyLong(), anyLong());
            salesService.recordSale(sale(8004L, CLIENT_ID).paidBonus(BigDecimal.ZERO).build(), null, "api");

            // Then
            assertTrue(ledgerService.findByTransaction(8003L).isEmpty());
            assertEquals(1, ledgerService.findByTransaction(8004L).size());
            assertEquals(500L, TestDatabase.storedBalance(jdbcTemplate, CLIENT_ID));
            assertEquals(500L, ledgerService.sumForClient(CLIENT_ID));
        }

        @Test
        @DisplayName("1.4 Sale commits when the notification insert fails, nothing is posted")
        void notificationInsertFailure_SaleCommits() throws Exception {
            printTestHeader("Outbox insert fails at the end of a posting");

            // Given: the jsonb column rejects the payload, after ledger and balance writes
            doReturn("{\"clientId\": ").when(objectMapper).writeValueAsString(any(BonusBalanceChangedEvent.class));

            // When
            assertDoesNotThrow(() -> salesService.recordSale(sale(8005L, CLIENT_ID).build(), null, "api"));

            // Then
            assertTrue(salesService.findSale(8005L).isPresent());
            assertTrue(ledgerService.findByTransaction(8005L).isEmpty());
            assertEquals(0L, TestDatabase.storedBalance(jdbcTemplate, CLIENT_ID));
            assertEquals(0L, outboxService.countUnpublished());
            printSuccess("Sale committed, ledger and balance writes rolled back");

            List<BonusPostingFailure> failures = failureRecorder.findUnresolved(10);
            assertEquals(1, failures.size());
            assertEquals(8005L, failures.get(0).getTransactionId());
            printSuccess("Failure recorded for repair");

            // The session is clean: the next sale of the client posts and notifies
            doCallRealMethod().when(objectMapper).writeValueAsString(any());
            salesService.recordSale(sale(8006L, CLIENT_ID).paidBonus(BigDecimal.ZERO).build(), null, "api");
            assertEquals(500L, TestDatabase.storedBalance(jdbcTemplate, CLIENT_ID));
            assertEquals(1L, outboxService.countUnpublished());
        }
    }

    @Nested
    @DisplayName("2. Discount reconciliation fails closed")
    class DiscountFailures {

        @Test
        @DisplayName("2.1 Line item write rolls back when reconciliation fails")
        void lineItemWriteRollsBack() {
            printTestHeader("Discount reconciliation fails on a line item change");

            // Given
            salesService.recordSale(sale(8101L, null).build(), null, "api");
            doThrow(new DataAccessResourceFailureException("discount update failed"))
                .when(discountEngine).reconcile(anyLong());

            // When / Then
            assertThrows(DataAccessResourceFailureException.class,
                () -> salesService.addLineItem(8101L, NewLineItem.of("Latte", new BigDecimal("100.00"))));

            assertTrue(salesService.getLineItems(8101L).isEmpty());
            assertEquals(0, TestDatabase.storedDiscount(jdbcTemplate, 8101L).signum());
            printSuccess("Line item not stored");
        }

        @Test
        @DisplayName("2.2 New sale with line items is not recorded when reconciliation fails")
        void saleRecordingRollsBack() {
            // Given
            doThrow(new DataAccessResourceFailureException("discount update failed"))
                .when(discountEngine).reconcile(anyLong());

            // When / Then
            assertThrows(DataAccessResourceFailureException.class,
                () -> salesService.recordSale(
                    sale(8102L, CLIENT_ID).lineItem(NewLineItem.of("Latte", new BigDecimal("100.00"))).build(),
                    null, "api"));

            assertTrue(salesService.findSale(8102L).isEmpty());
            assertTrue(ledgerService.findByTransaction(8102L).isEmpty());
            assertEquals(0L, TestDatabase.storedBalance(jdbcTemplate, CLIENT_ID));
            assertEquals(0L, outboxService.countUnpublished());
            printSuccess("Sale, posting and notification rolled back together");
        }
    }

    @Nested
    @DisplayName("3. Infrastructure outages")
    class InfrastructureOutages {

        @Test
        @DisplayName("3.1 Idempotency falls back to the database when Redis is down")
        void redisDown_FallsBackToDatabase() {
            printTestHeader("Redis unavailable");

            // Given
            when(valueOperations.get(anyString()))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));
            salesService.recordSale(sale(8201L, CLIENT_ID).build(), "order-8201", "api");

            // When
            Optional<Long> existing = idempotencyService.checkIdempotencyKey("order-8201");

            // Then
            assertEquals(Optional.of(8201L), existing);
            assertTrue(idempotencyService.checkIdempotencyKey("order-unknown").isEmpty());
            printSuccess("Database answered for the unavailable cache");
        }

        @Test
        @DisplayName("3.2 Balance notifications wait in the outbox while Kafka is down")
        void kafkaDown_EventsStayInOutbox() {
            printTestHeader("Kafka unavailable");

            // When
            salesService.recordSale(sale(8301L, CLIENT_ID).build(), null, "api");
            salesService.recordSale(sale(8302L, CLIENT_ID).paidBonus(BigDecimal.ZERO).build(), null, "api");

            // Then
            List<OutboxEvent> pending = outboxService.findUnpublishedEvents(10);
            assertEquals(2, pending.size());
            assertTrue(pending.stream().allMatch(event -> String.valueOf(CLIENT_ID).equals(event.getAggregateId())));
            assertTrue(pending.stream().noneMatch(OutboxEvent::isPublished));
            printSuccess("Events kept for the publisher");
        }
    }
}
