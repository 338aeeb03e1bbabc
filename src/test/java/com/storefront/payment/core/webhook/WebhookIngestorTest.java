package com.storefront.payment.core.webhook;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.payment.api.ConfigurationException;
import com.storefront.payment.compliance.PaymentAuditLogger;
import com.storefront.payment.config.PaymentProperties;
import com.storefront.payment.core.credentials.CredentialResolver;
import com.storefront.payment.domain.GatewayCredentials;
import com.storefront.payment.domain.GatewayEnvironment;
import com.storefront.payment.messaging.PaymentLifecycleEventProducer;
import com.storefront.payment.persistence.entity.WebhookNotificationEntity;
import com.storefront.payment.persistence.service.WebhookPersistenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookIngestorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String BODY = "{\"type\":\"PAYMENT_SUCCESS_WEBHOOK\",\"data\":{"
            + "\"order\":{\"order_id\":\"order-1\",\"order_amount\":499.0},"
            + "\"payment\":{\"payment_status\":\"SUCCESS\"}}}";

    @Mock
    private WebhookDeduplicationService deduplicationService;

    @Mock
    private WebhookPersistenceService persistenceService;

    @Mock
    private PaymentLifecycleEventProducer eventProducer;

    @Mock
    private PaymentAuditLogger auditLogger;

    @Mock
    private CredentialResolver credentialResolver;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final WebhookSignatureVerifier verifier = new WebhookSignatureVerifier(Duration.ofMinutes(5), clock);
    private PaymentProperties properties;
    private WebhookIngestor ingestor;

    @BeforeEach
    void setUp() {
        properties = new PaymentProperties();
        ingestor = new WebhookIngestor(verifier, deduplicationService, persistenceService, eventProducer,
                auditLogger, credentialResolver, properties, new ObjectMapper(), Runnable::run, clock);
    }

    @Test
    void validNotificationIsRecordedAndPublished() {
        when(credentialResolver.resolve()).thenReturn(credentials("client-secret"));
        when(deduplicationService.markFirstDelivery(anyString())).thenReturn(true);
        when(persistenceService.record(any())).thenReturn(true);
        String timestamp = String.valueOf(NOW.getEpochSecond());

        WebhookAck ack = ingestor.ingest(BODY, verifier.sign(timestamp + BODY, "client-secret"), timestamp);

        assertThat(ack.isReceived()).isTrue();
        assertThat(ack.isProcessed()).isTrue();
        ArgumentCaptor<WebhookNotificationEntity> captor = ArgumentCaptor.forClass(WebhookNotificationEntity.class);
        verify(persistenceService).record(captor.capture());
        WebhookNotificationEntity entity = captor.getValue();
        assertThat(entity.getNotificationId()).isEqualTo(ack.getNotificationId());
        assertThat(entity.getOrderId()).isEqualTo("order-1");
        assertThat(entity.getReportedStatus()).isEqualTo("SUCCESS");
        assertThat(entity.getEventType()).isEqualTo("PAYMENT_SUCCESS_WEBHOOK");
        assertThat(entity.getBodyHash()).isEqualTo(WebhookIngestor.sha256Hex(BODY));
        assertThat(entity.isSignatureValid()).isTrue();
        verify(eventProducer).publishWebhookReceived("order-1", "PAYMENT_SUCCESS_WEBHOOK", "SUCCESS");
    }

    @Test
    void dedicatedWebhookSecretTakesPrecedence() {
        properties.getWebhook().setSecret("webhook-secret");
        when(deduplicationService.markFirstDelivery(anyString())).thenReturn(true);
        when(persistenceService.record(any())).thenReturn(true);
        String timestamp = String.valueOf(NOW.getEpochSecond());

        WebhookAck ack = ingestor.ingest(BODY, verifier.sign(timestamp + BODY, "webhook-secret"), timestamp);

        assertThat(ack.isProcessed()).isTrue();
        verifyNoInteractions(credentialResolver);
    }

    @Test
    void invalidSignatureIsRecordedButNotPublished() {
        when(credentialResolver.resolve()).thenReturn(credentials("client-secret"));
        when(persistenceService.record(any())).thenReturn(true);
        String timestamp = String.valueOf(NOW.getEpochSecond());

        WebhookAck ack = ingestor.ingest(BODY, "forged", timestamp);

        assertThat(ack.isReceived()).isTrue();
        assertThat(ack.isProcessed()).isFalse();
        verifyNoInteractions(deduplicationService);
        verify(persistenceService).record(any());
        verify(auditLogger).logWebhook(ack.getNotificationId(), "order-1", "PAYMENT_SUCCESS_WEBHOOK", "SUCCESS", false);
        verify(eventProducer, never()).publishWebhookReceived(any(), any(), any());
    }

    @Test
    void redeliveryIsDroppedBeforePersistence() {
        when(credentialResolver.resolve()).thenReturn(credentials("client-secret"));
        when(deduplicationService.markFirstDelivery(anyString())).thenReturn(false);
        String timestamp = String.valueOf(NOW.getEpochSecond());

        WebhookAck ack = ingestor.ingest(BODY, verifier.sign(timestamp + BODY, "client-secret"), timestamp);

        assertThat(ack.isProcessed()).isTrue();
        verifyNoInteractions(persistenceService, eventProducer);
    }

    @Test
    void missingConfigurationStillAcknowledges() {
        when(credentialResolver.resolve()).thenThrow(
                new ConfigurationException(ConfigurationException.Reason.CONFIG_MISSING, "missing"));
        when(persistenceService.record(any())).thenReturn(true);

        WebhookAck ack = ingestor.ingest("not json", "sig", "123");

        assertThat(ack.isReceived()).isTrue();
        assertThat(ack.isProcessed()).isFalse();
        verify(persistenceService).record(any());
    }

    @Test
    void persistenceFailureDoesNotEscape() {
        when(credentialResolver.resolve()).thenReturn(credentials("client-secret"));
        when(deduplicationService.markFirstDelivery(anyString())).thenReturn(true);
        when(persistenceService.record(any())).thenThrow(new IllegalStateException("db down"));
        String timestamp = String.valueOf(NOW.getEpochSecond());

        WebhookAck ack = ingestor.ingest(BODY, verifier.sign(timestamp + BODY, "client-secret"), timestamp);

        assertThat(ack.isReceived()).isTrue();
        verify(eventProducer, never()).publishWebhookReceived(any(), any(), any());
    }

    private static GatewayCredentials credentials(String secret) {
        return GatewayCredentials.builder()
                .clientId("client-id")
                .clientSecret(secret)
                .environment(GatewayEnvironment.SANDBOX)
                .enabled(true)
                .build();
    }
}
