package com.storefront.payment.persistence.repository;

import com.storefront.payment.persistence.entity.WebhookNotificationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for gateway notifications.
 */
@Repository
public interface WebhookNotificationRepository extends JpaRepository<WebhookNotificationEntity, String> {

    Optional<WebhookNotificationEntity> findByBodyHashAndSignatureValid(String bodyHash, boolean signatureValid);
}
