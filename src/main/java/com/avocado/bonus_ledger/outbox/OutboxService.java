package com.avocado.bonus_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outbox of client notifications.
 *
 * Events are stored by the posting that causes them, in its transaction, and leave
 * through {@link OutboxPublisher}. Publishing state is tracked in short transactions of
 * their own so a slow broker never holds a posting open.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final OutboxEventRepository repository;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Stores an event in the caller's transaction, which must exist.
     *
     * The insert is a plain JDBC statement on the caller's connection, with no
     * transactional proxy and nothing left in the persistence context. A failure here
     * therefore stays inside a savepoint the caller holds.
     *
     * @param aggregateType selects the topic
     * @param aggregateId Kafka key, the client id for bonus events
     * @param payload serialized to JSON with the shared mapper
     */
    public OutboxEvent saveEvent(String aggregateType, String aggregateId,
                                 String eventType, Object payload) {
        if (!TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalTransactionStateException("Outbox events are written inside the posting transaction only");
        }
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, toJson(payload));
        Long sequenceNumber = jdbcTemplate.queryForObject(
            "INSERT INTO outbox_events (id, aggregate_type, aggregate_id, event_type, payload, created_at, retry_count) " +
            "VALUES (?, ?, ?, ?, CAST(? AS jsonb), ?, 0) " +
            "RETURNING sequence_number",
            Long.class,
            event.getId(),
            event.getAggregateType(),
            event.getAggregateId(),
            event.getEventType(),
            event.getPayload(),
            Timestamp.from(event.getCreatedAt())
        );

        log.debug("Queued {} for {} {}", eventType, aggregateType, aggregateId);
        return new OutboxEvent(event.getId(), aggregateType, aggregateId, eventType, event.getPayload(),
            event.getCreatedAt(), null, 0, null, sequenceNumber);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findUnpublishedEvents(int limit) {
        return repository.claimPending(limit).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        if (repository.markPublished(eventId, Instant.now()) == 0) {
            log.warn("Outbox event {} was already published or removed", eventId);
        }
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        String error = errorMessage;
        if (error != null && error.length() > MAX_ERROR_LENGTH) {
            error = error.substring(0, MAX_ERROR_LENGTH);
        }
        if (repository.recordSendFailure(eventId, error) > 0) {
            log.warn("Send of outbox event {} failed: {}", eventId, errorMessage);
        }
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, String aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countPending();
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize outbox payload " + payload.getClass().getSimpleName(), e);
        }
    }
}
