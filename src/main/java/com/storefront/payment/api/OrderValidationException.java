package com.storefront.payment.api;

import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Checkout input failed validation. Carries every field violation found; nothing was sent
 * to the gateway.
 */
public class OrderValidationException extends RuntimeException {

    private final List<FieldViolation> violations;

    public OrderValidationException(List<FieldViolation> violations) {
        super("Validation failed: " + violations.stream()
                .map(FieldViolation::getMessage)
                .collect(Collectors.joining(", ")));
        this.violations = List.copyOf(violations);
    }

    public List<FieldViolation> getViolations() {
        return violations;
    }

    @Value
    public static class FieldViolation {
        String field;
        String message;
    }
}
