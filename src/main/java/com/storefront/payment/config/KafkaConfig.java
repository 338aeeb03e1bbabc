package com.storefront.payment.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.storefront.payment.messaging.PaymentLifecycleEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producer for order lifecycle events, serialized as JSON so consumers need no Java
 * types. The mapper is local to the serializer; the application's own ObjectMapper stays the
 * one Spring Boot configures.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    /**
     * Upper bound on how long a send may block waiting for broker metadata. Events are
     * published on request threads, so an unreachable broker must not hold a shopper's redirect.
     */
    @Value("${payment.kafka.max-block:2s}")
    private Duration maxBlock;

    @Bean
    public ProducerFactory<String, PaymentLifecycleEvent> lifecycleEventProducerFactory() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlock.toMillis());

        Serializer<PaymentLifecycleEvent> serializer = (topic, data) -> {
            if (data == null) {
                return null;
            }
            try {
                byte[] bytes = mapper.writeValueAsBytes(data);
                log.debug("Serialized lifecycle event (topic={}, length={}, eventId={})", topic, bytes.length, data.getEventId());
                return bytes;
            } catch (Exception e) {
                log.error("Serialization failed for topic={}", topic, e);
                throw new IllegalStateException("Failed to serialize PaymentLifecycleEvent", e);
            }
        };
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), serializer);
    }

    @Bean
    public KafkaTemplate<String, PaymentLifecycleEvent> lifecycleEventKafkaTemplate(
            ProducerFactory<String, PaymentLifecycleEvent> lifecycleEventProducerFactory) {
        return new KafkaTemplate<>(lifecycleEventProducerFactory);
    }
}
