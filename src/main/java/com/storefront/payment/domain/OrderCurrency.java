package com.storefront.payment.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Currencies the storefront accepts at checkout.
 */
public enum OrderCurrency {

    INR,
    USD,
    EUR;

    public static Optional<OrderCurrency> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(c -> c.name().equals(code.trim()))
                .findFirst();
    }
}
