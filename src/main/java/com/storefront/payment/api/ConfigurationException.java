package com.storefront.payment.api;

/**
 * Gateway credentials are missing, disabled or malformed. Thrown before any network call;
 * the handler returns HTTP 503 so checkout can show "payments unavailable".
 */
public class ConfigurationException extends RuntimeException {

    public enum Reason {
        CONFIG_MISSING,
        DISABLED,
        INVALID_ENVIRONMENT
    }

    private final Reason reason;

    public ConfigurationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ConfigurationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
