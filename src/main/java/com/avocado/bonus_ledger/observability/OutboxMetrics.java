package com.avocado.bonus_ledger.observability;

import com.avocado.bonus_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Delivery metrics of client notifications.
 *
 * The backlog gauges show values cached by {@link MetricsScheduler}; a scrape does not
 * touch the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final int maxRetries;

    private final AtomicLong pending = new AtomicLong();
    private final AtomicLong oldestPendingAgeSeconds = new AtomicLong();
    private final AtomicLong stuck = new AtomicLong();

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.maxRetries = maxRetries;

        Gauge.builder("bonus.notifications.pending", pending, AtomicLong::get)
            .description("Balance notifications waiting in the outbox")
            .register(meterRegistry);
        Gauge.builder("bonus.notifications.pending.age.seconds", oldestPendingAgeSeconds, AtomicLong::get)
            .description("Age of the oldest waiting notification")
            .register(meterRegistry);
        Gauge.builder("bonus.notifications.stuck", stuck, AtomicLong::get)
            .description("Waiting notifications past the retry limit")
            .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            pending.set(outboxRepository.countPending());
            long age = outboxRepository.findOldestPendingCreatedAt()
                .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                .orElse(0L);
            oldestPendingAgeSeconds.set(age);
            stuck.set(outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries));
        } catch (DataAccessException e) {
            log.warn("Outbox metrics not refreshed: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        delivery(eventType, "sent").increment();
    }

    public void recordEventPublishFailed(String eventType) {
        delivery(eventType, "failed").increment();
    }

    public void recordEventDeadLettered(String eventType) {
        delivery(eventType, "given_up").increment();
    }

    private Counter delivery(String eventType, String outcome) {
        return meterRegistry.counter("bonus.notifications.delivery", "event_type", eventType, "outcome", outcome);
    }
}
