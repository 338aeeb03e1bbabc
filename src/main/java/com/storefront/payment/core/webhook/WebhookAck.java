package com.storefront.payment.core.webhook;

import lombok.Builder;
import lombok.Value;

/**
 * Acknowledgement returned to the gateway for every notification.
 */
@Value
@Builder
public class WebhookAck {

    boolean received;

    /** False when the signature did not verify; the notification is recorded but not acted on. */
    boolean processed;

    String notificationId;
}
