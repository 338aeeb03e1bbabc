package com.storefront.payment.persistence.service;

import com.storefront.payment.persistence.entity.WebhookNotificationEntity;
import com.storefront.payment.persistence.repository.WebhookNotificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Persists gateway notifications. Inserts are idempotent on (body hash, signature verdict):
 * a redelivered notification returns the existing row instead of failing. Not transactional:
 * a lost insert race must not mark a surrounding transaction rollback-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookPersistenceService {

    private final WebhookNotificationRepository repository;

    /**
     * Stores {@code notification} unless an equivalent row exists.
     *
     * @return true when a new row was written
     */
    public boolean record(WebhookNotificationEntity notification) {
        Optional<WebhookNotificationEntity> existing = repository.findByBodyHashAndSignatureValid(
                notification.getBodyHash(), notification.isSignatureValid());
        if (existing.isPresent()) {
            log.info("Webhook notification already recorded: notificationId={} orderId={}",
                    existing.get().getNotificationId(), existing.get().getOrderId());
            return false;
        }
        try {
            repository.saveAndFlush(notification);
            log.debug("Persisted webhook notification: notificationId={} orderId={} signatureValid={}",
                    notification.getNotificationId(), notification.getOrderId(), notification.isSignatureValid());
            return true;
        } catch (DataIntegrityViolationException e) {
            // Concurrent delivery of the same body won the insert.
            log.warn("Duplicate webhook notification detected (database constraint): bodyHash={}",
                    notification.getBodyHash());
            return false;
        }
    }
}
