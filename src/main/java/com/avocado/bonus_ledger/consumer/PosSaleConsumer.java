package com.avocado.bonus_ledger.consumer;

import com.avocado.bonus_ledger.observability.CorrelationContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Consumes sales from the POS sync feed.
 *
 * Offsets are acknowledged only after the sale is committed. Unparseable messages are
 * acknowledged and dropped; a failure while applying a sale leaves the offset
 * uncommitted so the message is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PosSaleConsumer {

    static final String CONSUMER_GROUP = "pos-sale-consumer";
    private static final String AGGREGATE_TYPE = "Sale";

    private final IdempotentEventProcessor eventProcessor;
    private final PosSaleHandler saleHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.pos-sales:pos-sales}",
        groupId = "${spring.kafka.consumer.group-id:avocado-bonus-ledger}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        CorrelationContext.begin(correlationIdOf(record));
        try {
            PosSaleMessage message = parse(record.value());
            if (message == null) {
                log.warn("Could not parse POS sale message at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }

            boolean processed = route(message);
            ack.acknowledge();

            if (processed) {
                log.info("Processed POS sale event: eventId={}, transactionId={}",
                        message.getEventId(), message.getTransactionId());
            }

        } catch (RuntimeException e) {
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        } finally {
            CorrelationContext.end();
        }
    }

    private boolean route(PosSaleMessage message) {
        String aggregateId = String.valueOf(message.getTransactionId());
        String eventType = message.getEventType() != null ? message.getEventType() : PosSaleMessage.EVENT_TYPE;

        if (!PosSaleMessage.EVENT_TYPE.equals(eventType)) {
            log.debug("Unknown event type: {}, skipping", eventType);
            eventProcessor.skipEvent(message.getEventId(), eventType, AGGREGATE_TYPE, aggregateId,
                    CONSUMER_GROUP, "Unknown event type");
            return false;
        }

        return eventProcessor.processEvent(
            message.getEventId(), eventType, AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP,
            () -> saleHandler.onSale(message)
        );
    }

    private PosSaleMessage parse(String json) {
        try {
            PosSaleMessage message = objectMapper.readValue(json, PosSaleMessage.class);
            if (message.getEventId() == null || message.getTransactionId() == null) {
                log.error("POS sale message without event_id or transaction_id");
                return null;
            }
            return message;
        } catch (JsonProcessingException e) {
            log.error("Failed to parse POS sale message: {}", e.getMessage());
            return null;
        }
    }

    private static String correlationIdOf(ConsumerRecord<String, String> record) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }
}
