package com.storefront.payment.domain;

import lombok.Value;

/**
 * Callback URLs attached to an order: where the shopper's browser returns and where the
 * gateway posts notifications.
 */
@Value
public class CallbackUrls {
    String returnUrl;
    String notifyUrl;
}
