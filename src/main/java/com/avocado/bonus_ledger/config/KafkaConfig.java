package com.avocado.bonus_ledger.config;

import org.apache.kafka.clients.admin.NewTopic;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.TopicBuilder;

/**
 * Topics owned by this service.
 *
 * bonus-events carries balance changes for the Telegram bot and is keyed by client id,
 * so every change for one client lands on the same partition in posting order.
 * pos-sales is fed by the POS synchronisation job.
 */
@Configuration
public class KafkaConfig {

    @Value("${kafka.topic.bonus-events:bonus-events}")
    private String bonusEventsTopic;

    @Value("${kafka.topic.pos-sales:pos-sales}")
    private String posSalesTopic;

    @Bean
    public NewTopic bonusEventsTopic() {
        return TopicBuilder.name(bonusEventsTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }

    @Bean
    public NewTopic posSalesTopic() {
        return TopicBuilder.name(posSalesTopic)
                .partitions(3)
                .replicas(1)
                .build();
    }
}
