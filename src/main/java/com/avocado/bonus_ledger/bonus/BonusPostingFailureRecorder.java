package com.avocado.bonus_ledger.bonus;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.util.List;

/**
 * Dead-letter store for failed automatic postings (bonus_posting_failures).
 *
 * Recording joins the caller's transaction so the failure row commits together with
 * the sale whose posting was rolled back.
 */
@Service
@Slf4j
public class BonusPostingFailureRecorder {

    private static final int MAX_MESSAGE_LENGTH = 2000;

    private final JdbcTemplate jdbcTemplate;

    public BonusPostingFailureRecorder(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void record(Long transactionId, Long clientId, Throwable error) {
        String message = error.getMessage();
        if (message != null && message.length() > MAX_MESSAGE_LENGTH) {
            message = message.substring(0, MAX_MESSAGE_LENGTH);
        }
        jdbcTemplate.update(
            "INSERT INTO bonus_posting_failures (transaction_id, client_id, error_type, error_message, failed_at) " +
            "VALUES (?, ?, ?, ?, NOW())",
            transactionId,
            clientId,
            error.getClass().getSimpleName(),
            message
        );
    }

    public long countUnresolved() {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM bonus_posting_failures WHERE resolved_at IS NULL", Long.class);
        return count != null ? count : 0L;
    }

    public List<BonusPostingFailure> findUnresolved(int limit) {
        return jdbcTemplate.query(
            "SELECT id, transaction_id, client_id, error_type, error_message, failed_at, resolved_at " +
            "FROM bonus_posting_failures WHERE resolved_at IS NULL ORDER BY failed_at, id LIMIT ?",
            failureRowMapper(),
            limit
        );
    }

    /**
     * Marks every open failure as repaired. Called when a full ledger rebuild completes.
     */
    public int resolveAll() {
        int resolved = jdbcTemplate.update(
            "UPDATE bonus_posting_failures SET resolved_at = NOW() WHERE resolved_at IS NULL");
        if (resolved > 0) {
            log.info("Resolved {} bonus posting failures", resolved);
        }
        return resolved;
    }

    private RowMapper<BonusPostingFailure> failureRowMapper() {
        return (rs, rowNum) -> {
            Timestamp resolvedAt = rs.getTimestamp("resolved_at");
            return new BonusPostingFailure(
                rs.getLong("id"),
                rs.getObject("transaction_id", Long.class),
                rs.getObject("client_id", Long.class),
                rs.getString("error_type"),
                rs.getString("error_message"),
                rs.getTimestamp("failed_at").toLocalDateTime(),
                resolvedAt != null ? resolvedAt.toLocalDateTime() : null
            );
        };
    }
}
