package com.storefront.payment.messaging;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Event emitted to Kafka at each step of a gateway order's life: creation, reconciliation of
 * a browser return, and receipt of a gateway notification. Keyed by merchant order id so
 * consumers see one order's events in order.
 */
@Value
@Builder
@Jacksonized
public class PaymentLifecycleEvent {

    String eventId;
    /** ORDER_CREATED, PAYMENT_RECONCILED or WEBHOOK_RECEIVED. */
    String eventType;
    String orderId;
    String cfOrderId;
    String correlationId;
    String environment;
    /** Gateway order status, or the status a notification reported. */
    String status;
    Boolean verified;
    String reason;
    Instant timestamp;
}
