package com.avocado.bonus_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Metrics for sale ingestion and the two engines.
 *
 * Metrics exposed:
 * - sales.recorded: sales written, tagged by source (api, pos_sync)
 * - bonus.postings / bonus.posted.minor_units: ledger entries written, by operation type
 * - bonus.posting.skipped: engine invocations that did nothing, by reason
 * - bonus.posting.failures: postings rolled back and dead-lettered
 * - bonus.posting.failures.unresolved: dead-letter backlog (refreshed by {@link MetricsScheduler})
 * - bonus.posting.duration: time spent posting one sale
 * - discount.recalculations: discount recomputations, by trigger
 * - engine.recalculation.duration: bulk recalculation runs, by engine
 */
@Component
public class BonusMetrics {

    private final MeterRegistry registry;
    private final Timer postingTimer;
    private final AtomicLong unresolvedFailures = new AtomicLong(0);

    public BonusMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.postingTimer = Timer.builder("bonus.posting.duration")
                .description("Time taken to post bonus entries for one sale")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        Gauge.builder("bonus.posting.failures.unresolved", unresolvedFailures, AtomicLong::get)
                .description("Failed bonus postings not yet repaired")
                .register(registry);
    }

    public void recordSaleRecorded(String source) {
        registry.counter("sales.recorded", "source", sanitizeTag(source)).increment();
    }

    public void recordPosting(String operationType, long amountMinor) {
        registry.counter("bonus.postings", "operation_type", sanitizeTag(operationType)).increment();
        registry.counter("bonus.posted.minor_units", "operation_type", sanitizeTag(operationType))
                .increment(Math.abs(amountMinor));
    }

    public void recordPostingSkipped(String reason) {
        registry.counter("bonus.posting.skipped", "reason", sanitizeTag(reason)).increment();
    }

    public void recordPostingFailure(String errorType) {
        registry.counter("bonus.posting.failures", "error", sanitizeTag(errorType)).increment();
    }

    public <T> T timePosting(Supplier<T> posting) {
        return postingTimer.record(posting);
    }

    public void updateUnresolvedFailures(long count) {
        unresolvedFailures.set(count);
    }

    public void recordDiscountRecalculated(String trigger) {
        registry.counter("discount.recalculations", "trigger", sanitizeTag(trigger)).increment();
    }

    public void recordRecalculationDuration(String engine, Duration duration) {
        registry.timer("engine.recalculation.duration", "engine", sanitizeTag(engine)).record(duration);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    /**
     * Keeps tag values low-cardinality and Prometheus-safe.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
