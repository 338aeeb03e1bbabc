package com.storefront.payment.domain;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Normalized outcome of one call to the gateway's order API. Exactly one of three shapes:
 * <ul>
 *   <li>{@link Outcome#OK}: the gateway answered 2xx; {@link #body} holds its JSON</li>
 *   <li>{@link Outcome#GATEWAY_ERROR}: the gateway answered with an error status and body</li>
 *   <li>{@link Outcome#TRANSPORT_ERROR}: no HTTP response was received</li>
 * </ul>
 */
@Value
@Builder
public class GatewayOrderResult {

    public enum Outcome {
        OK,
        GATEWAY_ERROR,
        TRANSPORT_ERROR
    }

    private static final int TOO_MANY_REQUESTS = 429;

    Outcome outcome;
    JsonNode body;
    String errorCode;
    String message;
    Integer httpStatus;
    TransportErrorKind transportErrorKind;

    public static GatewayOrderResult ok(JsonNode body, int httpStatus) {
        return GatewayOrderResult.builder()
                .outcome(Outcome.OK)
                .body(body)
                .httpStatus(httpStatus)
                .build();
    }

    public static GatewayOrderResult gatewayError(String code, String message, int httpStatus, JsonNode body) {
        return GatewayOrderResult.builder()
                .outcome(Outcome.GATEWAY_ERROR)
                .errorCode(code)
                .message(message)
                .httpStatus(httpStatus)
                .body(body)
                .build();
    }

    public static GatewayOrderResult transportError(TransportErrorKind kind, String message) {
        return GatewayOrderResult.builder()
                .outcome(Outcome.TRANSPORT_ERROR)
                .transportErrorKind(kind)
                .message(message)
                .build();
    }

    public boolean isOk() {
        return outcome == Outcome.OK;
    }

    public boolean isRateLimited() {
        return outcome == Outcome.GATEWAY_ERROR && httpStatus != null && httpStatus == TOO_MANY_REQUESTS;
    }

    /**
     * Transport failures and rate-limit responses may be retried by the caller with backoff.
     * Other gateway errors are final.
     */
    public boolean isRetryable() {
        return outcome == Outcome.TRANSPORT_ERROR || isRateLimited();
    }

    /** Text field from the response body, if present and non-blank. */
    public Optional<String> bodyText(String field) {
        if (body == null) {
            return Optional.empty();
        }
        JsonNode node = body.get(field);
        if (node == null || node.isNull() || node.asText().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(node.asText());
    }

    /** Raw {@code order_status} reported by the gateway. */
    public Optional<String> rawOrderStatus() {
        return isOk() ? bodyText("order_status") : Optional.empty();
    }

    public Optional<GatewayOrderStatus> orderStatus() {
        return rawOrderStatus().flatMap(GatewayOrderStatus::fromValue);
    }
}
