package com.avocado.bonus_ledger.bonus;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.Savepoint;
import java.util.function.Supplier;

/**
 * Runs JDBC work behind a savepoint of the surrounding transaction.
 *
 * If the work throws, the connection is rolled back to the savepoint and the exception
 * is rethrown; the surrounding transaction stays usable and is not marked rollback-only.
 * The work must not cross a {@code @Transactional} proxy that can throw, since Spring
 * would then mark the whole transaction for rollback.
 */
@Component
@RequiredArgsConstructor
public class SavepointExecutor {

    private final JdbcTemplate jdbcTemplate;

    public <T> T callIsolated(Supplier<T> work) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Savepoint requires an active transaction");
        }

        Savepoint savepoint = jdbcTemplate.execute(
            (ConnectionCallback<Savepoint>) connection -> connection.setSavepoint());

        T result;
        try {
            result = work.get();
        } catch (RuntimeException e) {
            try {
                jdbcTemplate.execute((ConnectionCallback<Void>) connection -> {
                    connection.rollback(savepoint);
                    return null;
                });
            } catch (RuntimeException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }

        jdbcTemplate.execute((ConnectionCallback<Void>) connection -> {
            connection.releaseSavepoint(savepoint);
            return null;
        });
        return result;
    }

    public void runIsolated(Runnable work) {
        callIsolated(() -> {
            work.run();
            return null;
        });
    }
}
