package com.storefront.payment.core.webhook;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.payment.api.ConfigurationException;
import com.storefront.payment.compliance.PaymentAuditLogger;
import com.storefront.payment.config.PaymentProperties;
import com.storefront.payment.core.credentials.CredentialResolver;
import com.storefront.payment.messaging.PaymentLifecycleEventProducer;
import com.storefront.payment.persistence.entity.WebhookNotificationEntity;
import com.storefront.payment.persistence.service.WebhookPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Accepts gateway notifications. The signature is checked on the request thread; recording,
 * de-duplication and event publishing run on the webhook executor so the gateway gets its
 * acknowledgement immediately. Notifications never change order state here: the browser
 * return path asks the gateway for the authoritative status.
 */
@Slf4j
@Service
public class WebhookIngestor {

    private final WebhookSignatureVerifier signatureVerifier;
    private final WebhookDeduplicationService deduplicationService;
    private final WebhookPersistenceService persistenceService;
    private final PaymentLifecycleEventProducer eventProducer;
    private final PaymentAuditLogger auditLogger;
    private final CredentialResolver credentialResolver;
    private final PaymentProperties properties;
    private final ObjectMapper objectMapper;
    private final Executor executor;
    private final Clock clock;

    public WebhookIngestor(WebhookSignatureVerifier signatureVerifier,
                           WebhookDeduplicationService deduplicationService,
                           WebhookPersistenceService persistenceService,
                           PaymentLifecycleEventProducer eventProducer,
                           PaymentAuditLogger auditLogger,
                           CredentialResolver credentialResolver,
                           PaymentProperties properties,
                           ObjectMapper objectMapper,
                           @Qualifier("webhookExecutor") Executor executor,
                           Clock clock) {
        this.signatureVerifier = signatureVerifier;
        this.deduplicationService = deduplicationService;
        this.persistenceService = persistenceService;
        this.eventProducer = eventProducer;
        this.auditLogger = auditLogger;
        this.credentialResolver = credentialResolver;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.executor = executor;
        this.clock = clock;
    }

    public WebhookAck ingest(String rawBody, String signature, String timestamp) {
        String body = rawBody == null ? "" : rawBody;
        String notificationId = UUID.randomUUID().toString();
        String correlationId = MDC.get("correlationId");
        boolean signatureValid = signatureVerifier.verify(body, signature, timestamp, signingSecret());
        log.info("Webhook received: notificationId={} length={} signatureValid={}",
                notificationId, body.length(), signatureValid);

        try {
            executor.execute(() -> process(notificationId, body, signatureValid, correlationId));
        } catch (Exception e) {
            log.error("Webhook processing could not be scheduled: notificationId={}", notificationId, e);
        }

        return WebhookAck.builder()
                .received(true)
                .processed(signatureValid)
                .notificationId(notificationId)
                .build();
    }

    private void process(String notificationId, String body, boolean signatureValid, String correlationId) {
        String previousCorrelationId = MDC.get("correlationId");
        if (correlationId != null) {
            MDC.put("correlationId", correlationId);
        }
        try {
            String bodyHash = sha256Hex(body);
            if (signatureValid && !deduplicationService.markFirstDelivery(bodyHash)) {
                return;
            }

            JsonNode json = parse(notificationId, body);
            String orderId = text(json, "data", "order", "order_id");
            String paymentStatus = text(json, "data", "payment", "payment_status");
            String eventType = text(json, "type");

            boolean recorded = persistenceService.record(WebhookNotificationEntity.builder()
                    .notificationId(notificationId)
                    .bodyHash(bodyHash)
                    .orderId(orderId)
                    .eventType(eventType)
                    .reportedStatus(paymentStatus)
                    .signatureValid(signatureValid)
                    .rawBody(body)
                    .correlationId(correlationId)
                    .receivedAt(clock.instant())
                    .build());
            auditLogger.logWebhook(notificationId, orderId, eventType, paymentStatus, signatureValid);

            if (signatureValid && recorded) {
                eventProducer.publishWebhookReceived(orderId, eventType, paymentStatus);
            }
        } catch (Exception e) {
            log.error("Webhook processing failed: notificationId={}", notificationId, e);
        } finally {
            if (previousCorrelationId == null) {
                MDC.remove("correlationId");
            } else {
                MDC.put("correlationId", previousCorrelationId);
            }
        }
    }

    /** Dedicated webhook secret if configured, else the gateway client secret. */
    private String signingSecret() {
        String configured = properties.getWebhook().getSecret();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        try {
            return credentialResolver.resolve().getClientSecret();
        } catch (ConfigurationException e) {
            log.error("No webhook signing secret: gateway configuration unavailable ({})", e.getReason());
            return null;
        }
    }

    private JsonNode parse(String notificationId, String body) {
        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            log.warn("Webhook body is not JSON: notificationId={}", notificationId);
            return null;
        }
    }

    private static String text(JsonNode root, String... path) {
        JsonNode node = root;
        for (String field : path) {
            if (node == null) {
                return null;
            }
            node = node.get(field);
        }
        return node == null || node.isNull() || node.isContainerNode() ? null : node.asText();
    }

    static String sha256Hex(String body) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(body.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
