package com.storefront.payment.domain;

/**
 * Where in the return callback a value was found.
 */
public enum CallbackSource {
    QUERY,
    BODY,
    REFERER
}
