package com.avocado.bonus_ledger.support;

import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;

/**
 * Test fixtures shared by the integration tests: wipes the schema between tests
 * and inserts clients and sales directly, bypassing the write path.
 */
public final class TestDatabase {

    private TestDatabase() {
    }

    /**
     * Empties every table and restores the seeded settings.
     */
    public static void reset(JdbcTemplate jdbcTemplate) {
        jdbcTemplate.execute(
            "TRUNCATE transaction_bonus, transaction_products, transactions, clients, " +
            "outbox_events, processed_events, bonus_posting_failures, bonus_recalculation_runs CASCADE");
        jdbcTemplate.update("DELETE FROM system_settings");
        jdbcTemplate.update(
            "INSERT INTO system_settings (key, value, description) VALUES " +
            "('bonus_system_enabled', 'true', 'Enables automatic bonus posting for closed transactions'), " +
            "('bonus_system_start_date', '2025-09-01', 'Transactions closed before this date earn and spend no bonus'), " +
            "('default_bonus_percent', '5.0', 'Default bonus accrual percentage')");
    }

    public static void insertClient(JdbcTemplate jdbcTemplate, long clientId) {
        jdbcTemplate.update(
            "INSERT INTO clients (client_id, firstname, lastname, phone, bonus) VALUES (?, ?, ?, ?, 0)",
            clientId, "Client", "#" + clientId, "+7900" + clientId);
    }

    /**
     * Inserts a sale without publishing any write event, so no engine reacts to it.
     */
    public static void insertSale(JdbcTemplate jdbcTemplate, long transactionId, Long clientId,
                                  LocalDateTime dateClose, String sum, String paidSum,
                                  String paidBonus, String bonusPercent) {
        jdbcTemplate.update(
            "INSERT INTO transactions (transaction_id, client_id, date_close, sum, paid_sum, paid_bonus, bonus_percent) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)",
            transactionId, clientId,
            dateClose != null ? Timestamp.valueOf(dateClose) : null,
            new BigDecimal(sum), new BigDecimal(paidSum), new BigDecimal(paidBonus), new BigDecimal(bonusPercent));
    }

    public static void insertLineItem(JdbcTemplate jdbcTemplate, long transactionId, String sum) {
        jdbcTemplate.update(
            "INSERT INTO transaction_products (transaction_id, product_name, quantity, price, sum) " +
            "VALUES (?, 'Item', 1, ?, ?)",
            transactionId, new BigDecimal(sum), new BigDecimal(sum));
    }

    public static long storedBalance(JdbcTemplate jdbcTemplate, long clientId) {
        BigDecimal bonus = jdbcTemplate.queryForObject(
            "SELECT bonus FROM clients WHERE client_id = ?", BigDecimal.class, clientId);
        return bonus.longValueExact();
    }

    public static BigDecimal storedDiscount(JdbcTemplate jdbcTemplate, long transactionId) {
        return jdbcTemplate.queryForObject(
            "SELECT discount FROM transactions WHERE transaction_id = ?", BigDecimal.class, transactionId);
    }
}
