package com.storefront.payment.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Order status as owned by the gateway. ACTIVE is the only non-terminal status;
 * the other three never transition further.
 */
public enum GatewayOrderStatus {

    ACTIVE(false),
    PAID(true),
    EXPIRED(true),
    TERMINATED(true);

    private final boolean terminal;

    GatewayOrderStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public static Optional<GatewayOrderStatus> fromValue(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
