package com.storefront.payment.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Gateway environment the credentials belong to. LIVE moves real money and only accepts
 * secure-transport callback URLs.
 */
public enum GatewayEnvironment {

    SANDBOX,
    LIVE;

    /**
     * Parses the environment names seen in stored configuration ("sandbox", "test",
     * "live", "production", "prod"). Blank input means SANDBOX; unknown input is empty.
     */
    public static Optional<GatewayEnvironment> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.of(SANDBOX);
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "sandbox":
            case "test":
                return Optional.of(SANDBOX);
            case "live":
            case "production":
            case "prod":
                return Optional.of(LIVE);
            default:
                return Optional.empty();
        }
    }

    public boolean isLive() {
        return this == LIVE;
    }
}
