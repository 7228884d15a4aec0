package com.avocado.bonus_ledger.bonus;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * JDBC access to bonus_recalculation_runs. Joins the caller's transaction.
 */
@Repository
public class RecalculationRunStore {

    private static final int MAX_ERROR_LENGTH = 2000;

    private static final String RUN_COLUMNS =
        "id, status, total_transactions, processed_transactions, last_date_close, last_transaction_id, " +
        "error_message, started_at, updated_at, finished_at";

    private final JdbcTemplate jdbcTemplate;

    public RecalculationRunStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public RecalculationRun start(long totalTransactions) {
        Long id = jdbcTemplate.queryForObject(
            "INSERT INTO bonus_recalculation_runs (status, total_transactions, processed_transactions, " +
            "  started_at, updated_at) VALUES (?, ?, 0, NOW(), NOW()) RETURNING id",
            Long.class,
            RecalculationRun.Status.IN_PROGRESS.name(),
            totalTransactions
        );
        return findById(id).orElseThrow();
    }

    public Optional<RecalculationRun> findById(Long id) {
        List<RecalculationRun> runs = jdbcTemplate.query(
            "SELECT " + RUN_COLUMNS + " FROM bonus_recalculation_runs WHERE id = ?",
            runRowMapper(),
            id
        );
        return runs.stream().findFirst();
    }

    /**
     * The most recent run that did not finish, if it is also the most recent run overall.
     */
    public Optional<RecalculationRun> findResumable() {
        List<RecalculationRun> runs = jdbcTemplate.query(
            "SELECT " + RUN_COLUMNS + " FROM bonus_recalculation_runs ORDER BY id DESC LIMIT 1",
            runRowMapper()
        );
        return runs.stream()
            .filter(run -> run.getStatus() == RecalculationRun.Status.IN_PROGRESS
                || run.getStatus() == RecalculationRun.Status.FAILED)
            .findFirst();
    }

    /**
     * Marks unfinished runs as abandoned before a fresh run wipes the ledger.
     */
    public int abandonUnfinished() {
        return jdbcTemplate.update(
            "UPDATE bonus_recalculation_runs SET status = ?, updated_at = NOW(), finished_at = NOW() " +
            "WHERE status IN (?, ?)",
            RecalculationRun.Status.ABANDONED.name(),
            RecalculationRun.Status.IN_PROGRESS.name(),
            RecalculationRun.Status.FAILED.name()
        );
    }

    public void advance(Long runId, long processedInBatch, LocalDateTime lastDateClose, Long lastTransactionId) {
        jdbcTemplate.update(
            "UPDATE bonus_recalculation_runs SET processed_transactions = processed_transactions + ?, " +
            "  last_date_close = ?, last_transaction_id = ?, updated_at = NOW() WHERE id = ?",
            processedInBatch,
            Timestamp.valueOf(lastDateClose),
            lastTransactionId,
            runId
        );
    }

    public void markInProgress(Long runId) {
        jdbcTemplate.update(
            "UPDATE bonus_recalculation_runs SET status = ?, error_message = NULL, updated_at = NOW() WHERE id = ?",
            RecalculationRun.Status.IN_PROGRESS.name(),
            runId
        );
    }

    public void markCompleted(Long runId) {
        jdbcTemplate.update(
            "UPDATE bonus_recalculation_runs SET status = ?, updated_at = NOW(), finished_at = NOW() WHERE id = ?",
            RecalculationRun.Status.COMPLETED.name(),
            runId
        );
    }

    public void markFailed(Long runId, String errorMessage) {
        String message = errorMessage;
        if (message != null && message.length() > MAX_ERROR_LENGTH) {
            message = message.substring(0, MAX_ERROR_LENGTH);
        }
        jdbcTemplate.update(
            "UPDATE bonus_recalculation_runs SET status = ?, error_message = ?, updated_at = NOW() WHERE id = ?",
            RecalculationRun.Status.FAILED.name(),
            message,
            runId
        );
    }

    private RowMapper<RecalculationRun> runRowMapper() {
        return (rs, rowNum) -> new RecalculationRun(
            rs.getLong("id"),
            RecalculationRun.Status.valueOf(rs.getString("status")),
            rs.getLong("total_transactions"),
            rs.getLong("processed_transactions"),
            toLocalDateTime(rs.getTimestamp("last_date_close")),
            rs.getObject("last_transaction_id", Long.class),
            rs.getString("error_message"),
            toLocalDateTime(rs.getTimestamp("started_at")),
            toLocalDateTime(rs.getTimestamp("updated_at")),
            toLocalDateTime(rs.getTimestamp("finished_at"))
        );
    }

    private static LocalDateTime toLocalDateTime(Timestamp timestamp) {
        return timestamp != null ? timestamp.toLocalDateTime() : null;
    }
}
