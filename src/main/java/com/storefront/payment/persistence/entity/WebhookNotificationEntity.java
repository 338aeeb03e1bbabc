package com.storefront.payment.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable record of every notification the gateway posted, verified or not. Redeliveries of
 * the same body collapse onto one row per signature verdict.
 */
@Entity
@Table(name = "webhook_notifications",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_webhook_body_hash_verdict", columnNames = {"body_hash", "signature_valid"})
    },
    indexes = {
        @Index(name = "idx_webhook_order_id", columnList = "order_id"),
        @Index(name = "idx_webhook_received_at", columnList = "received_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookNotificationEntity {

    @Id
    @Column(name = "notification_id", nullable = false, length = 36)
    private String notificationId;

    /** Hex SHA-256 of the raw body. */
    @Column(name = "body_hash", nullable = false, length = 64)
    private String bodyHash;

    @Column(name = "order_id")
    private String orderId;

    @Column(name = "event_type", length = 100)
    private String eventType;

    @Column(name = "reported_status", length = 50)
    private String reportedStatus;

    @Column(name = "signature_valid", nullable = false)
    private boolean signatureValid;

    @Lob
    @Column(name = "raw_body", nullable = false)
    private String rawBody;

    @Column(name = "correlation_id")
    private String correlationId;

    @Column(name = "received_at", nullable = false)
    private Instant receivedAt;

    @PrePersist
    protected void onCreate() {
        if (receivedAt == null) {
            receivedAt = Instant.now();
        }
    }
}
