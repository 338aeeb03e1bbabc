package com.storefront.payment.persistence.service;

import com.storefront.payment.persistence.entity.WebhookNotificationEntity;
import com.storefront.payment.persistence.repository.WebhookNotificationRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookPersistenceServiceTest {

    @Mock
    private WebhookNotificationRepository repository;

    @InjectMocks
    private WebhookPersistenceService service;

    private final WebhookNotificationEntity notification = WebhookNotificationEntity.builder()
            .notificationId("n-1")
            .bodyHash("hash-1")
            .orderId("order-1")
            .signatureValid(true)
            .rawBody("{}")
            .build();

    @Test
    void newNotificationIsSaved() {
        when(repository.findByBodyHashAndSignatureValid("hash-1", true)).thenReturn(Optional.empty());

        assertThat(service.record(notification)).isTrue();
        verify(repository).saveAndFlush(notification);
    }

    @Test
    void existingNotificationIsNotSavedAgain() {
        when(repository.findByBodyHashAndSignatureValid("hash-1", true)).thenReturn(Optional.of(notification));

        assertThat(service.record(notification)).isFalse();
        verify(repository, never()).saveAndFlush(any());
    }

    @Test
    void lostInsertRaceIsTreatedAsDuplicate() {
        when(repository.findByBodyHashAndSignatureValid("hash-1", true)).thenReturn(Optional.empty());
        when(repository.saveAndFlush(notification)).thenThrow(new DataIntegrityViolationException("uk_webhook_body_hash_verdict"));

        assertThat(service.record(notification)).isFalse();
    }
}
