package com.avocado.bonus_ledger.sales;

import com.avocado.bonus_ledger.bonus.BonusLedgerService;
import com.avocado.bonus_ledger.client.ClientService;
import com.avocado.bonus_ledger.support.TestDatabase;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.http.MediaType;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Tests for the sales API.
 *
 * These tests verify:
 * - Recording requires an Idempotency-Key and repeating a key returns the first sale
 * - The database answers idempotency lookups when Redis misses or fails
 * - Validation and domain errors map to 400, 404 and 409
 * - Line item and payment endpoints keep the discount current
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class SaleControllerTest {

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
        // Disable Kafka and outbox publisher for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private ClientService clientService;

    @Autowired
    private BonusLedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private StringRedisTemplate redisTemplate;

    @MockBean
    private ValueOperations<String, String> valueOperations;

    private static final long CLIENT_ID = 310L;

    @BeforeEach
    void setUp() {
        TestDatabase.reset(jdbcTemplate);
        clientService.registerClient(CLIENT_ID, "Maria", "Ivanova", "+79005550310");
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private String saleJson(long transactionId, Long clientId, String sum) {
        return "{"
            + "\"transaction_id\":" + transactionId + ","
            + (clientId != null ? "\"client_id\":" + clientId + "," : "")
            + "\"date_close\":\"2025-10-12T13:05:00\","
            + "\"sum\":" + sum + ","
            + "\"paid_sum\":90.00,"
            + "\"paid_bonus\":10.00,"
            + "\"bonus_percent\":5,"
            + "\"line_items\":[{\"product_name\":\"Poke bowl\",\"quantity\":1,\"price\":100.00,\"sum\":100.00}]"
            + "}";
    }

    private JsonNode postSale(String idempotencyKey, String body, int expectedStatus) throws Exception {
        String response = mockMvc.perform(post("/api/sales")
                        .header("Idempotency-Key", idempotencyKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().is(expectedStatus))
                .andReturn().getResponse().getContentAsString();
        return objectMapper.readTree(response);
    }

    @Test
    @DisplayName("Recording a sale returns 201 with the reconciled discount and posts bonus")
    void recordSale_Returns201() throws Exception {
        printTestHeader("Record Sale - Created");

        JsonNode sale = postSale("key-201", saleJson(6001L, CLIENT_ID, "100.00"), 201);

        assertEquals(6001L, sale.get("transaction_id").asLong());
        assertEquals(0, BigDecimal.ZERO.compareTo(sale.get("discount").decimalValue()));
        assertEquals(2, ledgerService.findByTransaction(6001L).size());
        assertEquals(-500L, TestDatabase.storedBalance(jdbcTemplate, CLIENT_ID));
        verify(valueOperations).set(eq("idempotency:key-201"), eq("6001"), any(Duration.class));
        printSuccess("Sale 6001 recorded, bonus posted, key cached");
    }

    @Test
    @DisplayName("Same key twice returns the first sale with 200 and records it once")
    void sameKeyTwice_ReturnsOriginal() throws Exception {
        printTestHeader("Idempotency - Database Fallback");

        // Given: Redis never has the key
        when(valueOperations.get(anyString())).thenReturn(null);

        JsonNode first = postSale("key-dup", saleJson(6002L, CLIENT_ID, "100.00"), 201);
        JsonNode second = postSale("key-dup", saleJson(6002L, CLIENT_ID, "100.00"), 200);

        assertEquals(first.get("transaction_id").asLong(), second.get("transaction_id").asLong());
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM transactions WHERE idempotency_key = 'key-dup'", Integer.class);
        assertEquals(1, count);
        assertEquals(2, ledgerService.findByTransaction(6002L).size());
        printSuccess("Second request answered from the database");
    }

    @Test
    @DisplayName("Redis hit answers without recording anything")
    void redisHit_ReturnsCachedSale() throws Exception {
        postSale("key-cached", saleJson(6003L, CLIENT_ID, "100.00"), 201);
        when(valueOperations.get("idempotency:key-other")).thenReturn("6003");

        JsonNode replay = postSale("key-other", saleJson(6999L, CLIENT_ID, "100.00"), 200);

        assertEquals(6003L, replay.get("transaction_id").asLong());
        assertFalse(jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM transactions WHERE transaction_id = 6999)", Boolean.class));
    }

    @Test
    @DisplayName("Cached key of a sale that was never committed is dropped and the sale is recorded")
    void staleRedisEntry_RecordsSale() throws Exception {
        printTestHeader("Idempotency - Stale Cache Entry");

        // Given: Redis maps the key to a transaction the database does not have
        when(valueOperations.get("idempotency:key-stale")).thenReturn("6998");

        // When
        JsonNode recorded = postSale("key-stale", saleJson(6010L, CLIENT_ID, "100.00"), 201);

        // Then
        assertEquals(6010L, recorded.get("transaction_id").asLong());
        verify(redisTemplate).delete("idempotency:key-stale");
        verify(valueOperations).set(eq("idempotency:key-stale"), eq("6010"), any(Duration.class));
        assertEquals(2, ledgerService.findByTransaction(6010L).size());
        printSuccess("Stale entry evicted, sale 6010 recorded and cached");
    }

    @Test
    @DisplayName("Redis failure falls back to the database")
    void redisFailure_FallsBackToDatabase() throws Exception {
        when(valueOperations.get(anyString())).thenThrow(new RedisConnectionFailureException("Connection refused"));

        postSale("key-down", saleJson(6004L, CLIENT_ID, "100.00"), 201);
        JsonNode replay = postSale("key-down", saleJson(6004L, CLIENT_ID, "100.00"), 200);

        assertEquals(6004L, replay.get("transaction_id").asLong());
    }

    @Test
    @DisplayName("Missing Idempotency-Key is a bad request")
    void missingKey_Returns400() throws Exception {
        mockMvc.perform(post("/api/sales")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(saleJson(6005L, CLIENT_ID, "100.00")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    @DisplayName("Negative sum is a validation error")
    void negativeSum_Returns400() throws Exception {
        mockMvc.perform(post("/api/sales")
                        .header("Idempotency-Key", "key-negative")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(saleJson(6006L, CLIENT_ID, "-1.00")))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Unknown client is 404 and nothing is recorded")
    void unknownClient_Returns404() throws Exception {
        mockMvc.perform(post("/api/sales")
                        .header("Idempotency-Key", "key-stranger")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(saleJson(6007L, 999L, "100.00")))
                .andExpect(status().isNotFound());

        mockMvc.perform(get("/api/sales/6007")).andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Known transaction id under a new key is a conflict")
    void duplicateTransactionId_Returns409() throws Exception {
        postSale("key-a", saleJson(6008L, CLIENT_ID, "100.00"), 201);

        mockMvc.perform(post("/api/sales")
                        .header("Idempotency-Key", "key-b")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(saleJson(6008L, CLIENT_ID, "100.00")))
                .andExpect(status().isConflict());

        verify(valueOperations, never()).set(eq("idempotency:key-b"), anyString(), any(Duration.class));
    }

    @Test
    @DisplayName("Line item and payment endpoints keep the discount current")
    void lineItemsAndPayment_UpdateDiscount() throws Exception {
        printTestHeader("Line Items and Payment - Discount");

        postSale("key-items", saleJson(6009L, CLIENT_ID, "100.00"), 201);

        String added = mockMvc.perform(post("/api/sales/6009/line-items")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"product_name\":\"Lemonade\",\"quantity\":1,\"price\":12.50,\"sum\":12.50}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        long itemId = objectMapper.readTree(added).get("id").asLong();

        mockMvc.perform(get("/api/sales/6009/line-items"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
        assertEquals(0, new BigDecimal("12.50").compareTo(TestDatabase.storedDiscount(jdbcTemplate, 6009L)));

        String updated = mockMvc.perform(put("/api/sales/6009/payment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"paid_sum\":102.50,\"paid_bonus\":10.00}"))
                .andExpect(status().isOk())
                .andReturn().getResponse().getContentAsString();
        assertEquals(0, BigDecimal.ZERO.compareTo(objectMapper.readTree(updated).get("discount").decimalValue()));

        mockMvc.perform(delete("/api/sales/6009/line-items/" + itemId))
                .andExpect(status().isNoContent());
        assertEquals(0, BigDecimal.ZERO.compareTo(TestDatabase.storedDiscount(jdbcTemplate, 6009L)));

        // bonus stays as posted on insert
        assertEquals(2, ledgerService.findByTransaction(6009L).size());
        printSuccess("Discount followed items and payment");
    }

    @Test
    @DisplayName("Line item of another sale is rejected")
    void foreignLineItem_Returns400() throws Exception {
        postSale("key-x", saleJson(6010L, CLIENT_ID, "100.00"), 201);

        mockMvc.perform(delete("/api/sales/6010/line-items/987654"))
                .andExpect(status().isBadRequest());
    }
}
