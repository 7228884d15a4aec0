package com.avocado.bonus_ledger.outbox;

import com.avocado.bonus_ledger.bonus.BonusPostingEngine;
import com.avocado.bonus_ledger.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;

/**
 * Drains the outbox to Kafka.
 *
 * Events go out one at a time, keyed by client id, and each send is confirmed before
 * the next. When a send fails, the remaining events of that client wait for the next
 * pass, so the bot never sees a client's balance changes out of order. An event past
 * the retry limit stays in the table for manual repair and blocks its client.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final String bonusEventsTopic;
    private final int batchSize;
    private final int maxRetries;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           OutboxMetrics outboxMetrics,
                           @Value("${kafka.topic.bonus-events:bonus-events}") String bonusEventsTopic,
                           @Value("${outbox.publisher.batch-size:100}") int batchSize,
                           @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.outboxMetrics = outboxMetrics;
        this.bonusEventsTopic = bonusEventsTopic;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
    }

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findUnpublishedEvents(batchSize);
        } catch (DataAccessException e) {
            log.error("Could not read the outbox, retrying on the next pass", e);
            return;
        }
        if (events.isEmpty()) {
            return;
        }

        Set<String> held = new HashSet<>();
        int sent = 0;
        for (OutboxEvent event : events) {
            String key = event.getAggregateType() + ":" + event.getAggregateId();
            if (held.contains(key)) {
                continue;
            }
            if (publish(event)) {
                sent++;
            } else {
                held.add(key);
            }
        }
        log.debug("Outbox pass: {} of {} events sent, {} clients held back", sent, events.size(), held.size());
    }

    /**
     * Runs one pass immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }

    private boolean publish(OutboxEvent event) {
        if (event.getRetryCount() >= maxRetries) {
            log.warn("Outbox event {} ({} for {}) is past {} retries, left for manual repair",
                event.getId(), event.getEventType(), event.getAggregateId(), maxRetries);
            outboxMetrics.recordEventDeadLettered(event.getEventType());
            return false;
        }

        try {
            SendResult<String, String> result = kafkaTemplate
                .send(topicFor(event), event.getAggregateId(), event.getPayload())
                .get();
            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            log.debug("Sent outbox event {} to {}-{}@{}", event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed(event, "Interrupted while sending");
            return false;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            failed(event, cause.getMessage());
            return false;
        } catch (RuntimeException e) {
            failed(event, e.getMessage());
            return false;
        }
    }

    private void failed(OutboxEvent event, String reason) {
        log.error("Sending outbox event {} ({} for {}) failed: {}",
            event.getId(), event.getEventType(), event.getAggregateId(), reason);
        outboxService.markFailed(event.getId(), reason);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
    }

    private String topicFor(OutboxEvent event) {
        if (BonusPostingEngine.AGGREGATE_TYPE.equals(event.getAggregateType())) {
            return bonusEventsTopic;
        }
        throw new IllegalStateException("No topic for aggregate type " + event.getAggregateType());
    }
}
