package com.storefront.payment.messaging;

import com.storefront.payment.domain.CreatedOrder;
import com.storefront.payment.domain.FinalOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes order lifecycle events to Kafka. Publishing is best effort: a broker failure is
 * logged and never fails the checkout, return or webhook that triggered it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentLifecycleEventProducer {

    public static final String ORDER_CREATED = "ORDER_CREATED";
    public static final String PAYMENT_RECONCILED = "PAYMENT_RECONCILED";
    public static final String WEBHOOK_RECEIVED = "WEBHOOK_RECEIVED";

    private final KafkaTemplate<String, PaymentLifecycleEvent> kafkaTemplate;

    @Value("${payment.kafka.topic.lifecycle-events:payment-lifecycle-events}")
    private String topic;

    public void publishCreated(CreatedOrder order) {
        send(PaymentLifecycleEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(ORDER_CREATED)
                .orderId(order.getOrderId())
                .cfOrderId(order.getCfOrderId())
                .correlationId(MDC.get("correlationId"))
                .environment(order.getEnvironment() == null ? null : order.getEnvironment().name())
                .status(order.getOrderStatus())
                .timestamp(Instant.now())
                .build());
    }

    public void publishReconciled(FinalOutcome outcome, String gatewayStatus) {
        send(PaymentLifecycleEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(PAYMENT_RECONCILED)
                .orderId(outcome.getOrderId())
                .correlationId(MDC.get("correlationId"))
                .status(gatewayStatus)
                .verified(outcome.isVerified())
                .reason(outcome.getReason())
                .timestamp(Instant.now())
                .build());
    }

    public void publishWebhookReceived(String orderId, String eventType, String reportedStatus) {
        send(PaymentLifecycleEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(WEBHOOK_RECEIVED)
                .orderId(orderId)
                .correlationId(MDC.get("correlationId"))
                .status(reportedStatus)
                .reason(eventType)
                .timestamp(Instant.now())
                .build());
    }

    private void send(PaymentLifecycleEvent event) {
        log.info("Publishing lifecycle event: key={} eventId={} eventType={} status={}",
                event.getOrderId(), event.getEventId(), event.getEventType(), event.getStatus());
        try {
            CompletableFuture<SendResult<String, PaymentLifecycleEvent>> future =
                    kafkaTemplate.send(topic, event.getOrderId(), event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish lifecycle event key={} eventId={}",
                            event.getOrderId(), event.getEventId(), ex);
                } else {
                    log.debug("Published lifecycle event key={} eventId={} partition={} offset={}",
                            event.getOrderId(), event.getEventId(),
                            result != null ? result.getRecordMetadata().partition() : null,
                            result != null ? result.getRecordMetadata().offset() : null);
                }
            });
        } catch (Exception e) {
            log.error("Kafka send rejected for lifecycle event key={} eventId={}",
                    event.getOrderId(), event.getEventId(), e);
        }
    }
}
