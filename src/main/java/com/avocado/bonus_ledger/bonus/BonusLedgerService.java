package com.avocado.bonus_ledger.bonus;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Access to the append-only transaction_bonus ledger.
 *
 * Entries are never updated. The only bulk delete is the full wipe at the start of
 * a recalculation run. Callers are responsible for holding the client's row lock
 * (see ClientService#lockBonusBalance) while appending, so that the chained
 * balances stay contiguous.
 *
 * Methods here declare no transaction boundary and always join the caller's
 * transaction, including the savepoint-protected bonus posting.
 */
@Service
@Slf4j
public class BonusLedgerService {

    private static final String ENTRY_COLUMNS =
        "id, client_id, transaction_id, operation_type, amount, balance_before, balance_after, " +
        "description, bonus_percent, transaction_sum, processed_at, created_at";

    private final JdbcTemplate jdbcTemplate;

    public BonusLedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Appends an entry and returns it with its generated id and creation time.
     */
    public BonusLedgerEntry append(BonusLedgerEntry entry) {
        if (entry.getId() != null) {
            throw new IllegalArgumentException("Ledger entry is already stored: " + entry.getId());
        }
        return jdbcTemplate.queryForObject(
            "INSERT INTO transaction_bonus (client_id, transaction_id, operation_type, amount, " +
            "  balance_before, balance_after, description, bonus_percent, transaction_sum, " +
            "  processed_at, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, NOW(), NOW()) " +
            "RETURNING id, created_at",
            (rs, rowNum) -> entry.withStoredIdentity(
                rs.getLong("id"),
                rs.getTimestamp("created_at").toLocalDateTime()
            ),
            entry.getClientId(),
            entry.getTransactionId(),
            entry.getOperationType().name(),
            entry.getAmount(),
            entry.getBalanceBefore(),
            entry.getBalanceAfter(),
            entry.getDescription(),
            entry.getBonusPercent(),
            entry.getTransactionSum(),
            Timestamp.valueOf(entry.getProcessedAt() != null ? entry.getProcessedAt() : LocalDateTime.now())
        );
    }

    /**
     * True if any entry references the transaction. This is the at-most-once guard
     * for automatic postings.
     */
    public boolean hasEntriesForTransaction(Long transactionId) {
        Boolean exists = jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM transaction_bonus WHERE transaction_id = ?)",
            Boolean.class,
            transactionId
        );
        return Boolean.TRUE.equals(exists);
    }

    public List<BonusLedgerEntry> findByTransaction(Long transactionId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM transaction_bonus WHERE transaction_id = ? ORDER BY id",
            entryRowMapper(),
            transactionId
        );
    }

    /**
     * All entries of a client in the order they were written.
     */
    public List<BonusLedgerEntry> findChainForClient(Long clientId) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM transaction_bonus WHERE client_id = ? ORDER BY id",
            entryRowMapper(),
            clientId
        );
    }

    /**
     * Latest entries of a client by processing time, newest first.
     */
    public List<BonusLedgerEntry> findRecentForClient(Long clientId, int limit) {
        return jdbcTemplate.query(
            "SELECT " + ENTRY_COLUMNS + " FROM transaction_bonus WHERE client_id = ? " +
            "ORDER BY processed_at DESC, id DESC LIMIT ?",
            entryRowMapper(),
            clientId,
            limit
        );
    }

    public long sumForClient(Long clientId) {
        BigDecimal sum = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(amount), 0) FROM transaction_bonus WHERE client_id = ?",
            BigDecimal.class,
            clientId
        );
        return MinorUnits.fromColumn(sum);
    }

    public List<OperationStatistics> statisticsForClient(Long clientId) {
        return jdbcTemplate.query(
            "SELECT operation_type, COUNT(*) AS operation_count, COALESCE(SUM(amount), 0) AS total_amount, " +
            "  MAX(processed_at) AS last_processed_at " +
            "FROM transaction_bonus WHERE client_id = ? " +
            "GROUP BY operation_type ORDER BY operation_type",
            (rs, rowNum) -> {
                Timestamp lastProcessedAt = rs.getTimestamp("last_processed_at");
                return new OperationStatistics(
                    OperationType.valueOf(rs.getString("operation_type")),
                    rs.getLong("operation_count"),
                    MinorUnits.fromColumn(rs.getBigDecimal("total_amount")),
                    lastProcessedAt != null ? lastProcessedAt.toLocalDateTime() : null
                );
            },
            clientId
        );
    }

    public LedgerTotals totals() {
        return jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(CASE WHEN amount > 0 THEN amount ELSE 0 END), 0) AS earned_total, " +
            "       COALESCE(SUM(CASE WHEN amount < 0 THEN ABS(amount) ELSE 0 END), 0) AS spent_total " +
            "FROM transaction_bonus",
            (rs, rowNum) -> new LedgerTotals(
                MinorUnits.fromColumn(rs.getBigDecimal("earned_total")),
                MinorUnits.fromColumn(rs.getBigDecimal("spent_total"))
            )
        );
    }

    /**
     * Deletes the whole ledger. Only the recalculation job calls this, together with
     * resetting every client's balance in the same transaction.
     */
    public int deleteAll() {
        int deleted = jdbcTemplate.update("DELETE FROM transaction_bonus");
        log.info("Deleted {} bonus ledger entries", deleted);
        return deleted;
    }

    private RowMapper<BonusLedgerEntry> entryRowMapper() {
        return (rs, rowNum) -> new BonusLedgerEntry(
                rs.getLong("id"),
                rs.getLong("client_id"),
                rs.getObject("transaction_id", Long.class),
                OperationType.valueOf(rs.getString("operation_type")),
                MinorUnits.fromColumn(rs.getBigDecimal("amount")),
                MinorUnits.fromColumn(rs.getBigDecimal("balance_before")),
                MinorUnits.fromColumn(rs.getBigDecimal("balance_after")),
                rs.getString("description"),
                rs.getBigDecimal("bonus_percent"),
                rs.getBigDecimal("transaction_sum"),
                rs.getTimestamp("processed_at").toLocalDateTime(),
                rs.getTimestamp("created_at").toLocalDateTime()
        );
    }
}
