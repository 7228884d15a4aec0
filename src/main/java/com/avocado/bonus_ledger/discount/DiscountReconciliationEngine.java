package com.avocado.bonus_ledger.discount;

import com.avocado.bonus_ledger.sales.SaleNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps transactions.discount equal to the uncovered part of each receipt.
 *
 * This is the only writer of the discount column. Methods join the caller's transaction;
 * any failure propagates and aborts the write that triggered the recomputation.
 */
@Service
@Slf4j
public class DiscountReconciliationEngine {

    private static final String BATCH_CALCULATION =
        "SELECT tp.transaction_id, " +
        "  GREATEST(SUM(tp.sum) - COALESCE(t.paid_sum, 0) - COALESCE(t.paid_bonus, 0), 0)::NUMERIC(10,2) " +
        "    AS calculated_discount " +
        "FROM transaction_products tp " +
        "JOIN transactions t ON tp.transaction_id = t.transaction_id ";

    private final JdbcTemplate jdbcTemplate;

    public DiscountReconciliationEngine(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Computes the discount a transaction should have, without writing it.
     * A transaction without line items has no discount.
     */
    public BigDecimal calculateDiscount(Long transactionId) {
        List<BigDecimal[]> rows = jdbcTemplate.query(
            "SELECT t.paid_sum, t.paid_bonus, " +
            "  (SELECT SUM(tp.sum) FROM transaction_products tp WHERE tp.transaction_id = t.transaction_id) " +
            "    AS items_total " +
            "FROM transactions t WHERE t.transaction_id = ?",
            (rs, rowNum) -> new BigDecimal[] {
                rs.getBigDecimal("items_total"),
                rs.getBigDecimal("paid_sum"),
                rs.getBigDecimal("paid_bonus")
            },
            transactionId
        );
        if (rows.isEmpty()) {
            throw new SaleNotFoundException(transactionId);
        }
        BigDecimal[] row = rows.get(0);
        if (row[0] == null) {
            return BigDecimal.ZERO.setScale(2);
        }
        return DiscountCalculation.discount(row[0], row[1], row[2]);
    }

    /**
     * Recomputes and stores the discount of one transaction.
     *
     * @return the stored discount
     */
    public BigDecimal reconcile(Long transactionId) {
        BigDecimal discount = calculateDiscount(transactionId);
        jdbcTemplate.update(
            "UPDATE transactions SET discount = ?, updated_at = NOW() WHERE transaction_id = ?",
            discount,
            transactionId
        );
        log.debug("Discount of transaction {} set to {}", transactionId, discount);
        return discount;
    }

    /**
     * Recomputes the given transactions in one statement. Transactions without line
     * items, and unknown ids, are left out of the result.
     */
    public List<DiscountChange> reconcileBatch(List<Long> transactionIds) {
        if (transactionIds.isEmpty()) {
            return List.of();
        }
        Object[] ids = transactionIds.toArray();
        String placeholders = String.join(", ", Collections.nCopies(ids.length, "?"));

        Map<Long, BigDecimal> oldDiscounts = new LinkedHashMap<>();
        jdbcTemplate.query(
            "SELECT transaction_id, discount FROM transactions WHERE transaction_id IN (" + placeholders + ") " +
            "ORDER BY transaction_id FOR UPDATE",
            rs -> {
                oldDiscounts.put(rs.getLong("transaction_id"), rs.getBigDecimal("discount"));
            },
            ids
        );

        List<DiscountChange> changes = new ArrayList<>();
        jdbcTemplate.query(
            "WITH discount_calculations AS (" + BATCH_CALCULATION +
            "  WHERE tp.transaction_id IN (" + placeholders + ") GROUP BY tp.transaction_id, t.paid_sum, t.paid_bonus) " +
            "UPDATE transactions t SET discount = dc.calculated_discount, updated_at = NOW() " +
            "FROM discount_calculations dc WHERE t.transaction_id = dc.transaction_id " +
            "RETURNING t.transaction_id, t.discount",
            rs -> {
                Long transactionId = rs.getLong("transaction_id");
                BigDecimal oldDiscount = oldDiscounts.get(transactionId);
                changes.add(new DiscountChange(
                    transactionId,
                    oldDiscount != null ? oldDiscount : BigDecimal.ZERO.setScale(2),
                    rs.getBigDecimal("discount"),
                    true
                ));
            },
            ids
        );

        changes.sort((left, right) -> left.getTransactionId().compareTo(right.getTransactionId()));
        return changes;
    }

    /**
     * Recomputes every transaction that has line items in a single aggregated update.
     *
     * @return number of rows updated
     */
    public int reconcileAll() {
        return jdbcTemplate.update(
            "UPDATE transactions t SET discount = dc.calculated_discount, updated_at = NOW() " +
            "FROM (" + BATCH_CALCULATION + "GROUP BY tp.transaction_id, t.paid_sum, t.paid_bonus) dc " +
            "WHERE t.transaction_id = dc.transaction_id"
        );
    }

    public long countTransactions() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM transactions", Long.class);
        return count != null ? count : 0L;
    }

    public BigDecimal sumPositiveDiscounts() {
        BigDecimal total = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(discount), 0)::NUMERIC(10,2) FROM transactions WHERE discount > 0",
            BigDecimal.class
        );
        return total != null ? total : BigDecimal.ZERO.setScale(2);
    }
}
