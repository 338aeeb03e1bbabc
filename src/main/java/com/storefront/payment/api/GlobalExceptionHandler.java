package com.storefront.payment.api;

import com.storefront.payment.domain.GatewayOrderResult;
import com.storefront.payment.domain.TransportErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Centralized error handling for the payment API. Returns consistent JSON
 * ({@code {"error": CODE, "message"|"details": ...}}) and status codes that let the
 * storefront tell "fix your input" from "payments unavailable" from "gateway trouble".
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(FieldError::getField,
                        e -> e.getDefaultMessage() != null ? e.getDefaultMessage() : "invalid",
                        (first, second) -> first,
                        LinkedHashMap::new));
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "details", errors));
    }

    @ExceptionHandler(OrderValidationException.class)
    public ResponseEntity<Map<String, Object>> handleOrderValidation(OrderValidationException ex) {
        List<Map<String, String>> details = ex.getViolations().stream()
                .map(v -> Map.of("field", v.getField(), "message", v.getMessage()))
                .collect(Collectors.toList());
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "VALIDATION_FAILED", "details", details));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
        return ResponseEntity
                .status(HttpStatus.BAD_REQUEST)
                .body(Map.of("error", "BAD_REQUEST", "message", "Request body is missing or malformed"));
    }

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<Map<String, String>> handleConfiguration(ConfigurationException ex) {
        log.warn("Payments unavailable: reason={} message={}", ex.getReason(), ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("error", "PAYMENTS_UNAVAILABLE", "message", "Payments are currently unavailable"));
    }

    @ExceptionHandler(GatewayRequestException.class)
    public ResponseEntity<Map<String, String>> handleGateway(GatewayRequestException ex) {
        GatewayOrderResult result = ex.getResult();
        log.warn("Gateway request failed: {}", ex.getMessage());
        if (result.getOutcome() == GatewayOrderResult.Outcome.TRANSPORT_ERROR) {
            boolean timeout = result.getTransportErrorKind() == TransportErrorKind.TIMEOUT;
            return ResponseEntity
                    .status(timeout ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of(
                            "error", timeout ? "GATEWAY_TIMEOUT" : "GATEWAY_UNREACHABLE",
                            "message", "Payment gateway did not respond. Retry later."));
        }
        if (result.isRateLimited()) {
            return ResponseEntity
                    .status(HttpStatus.TOO_MANY_REQUESTS)
                    .body(Map.of("error", "RATE_LIMITED", "message", "Payment gateway is rate limiting requests. Retry later."));
        }
        if (result.getHttpStatus() != null && result.getHttpStatus() == HttpStatus.NOT_FOUND.value()) {
            return ResponseEntity
                    .status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", "ORDER_NOT_FOUND", "message", messageOf(result)));
        }
        return ResponseEntity
                .status(HttpStatus.BAD_GATEWAY)
                .body(Map.of("error", "GATEWAY_ERROR", "message", messageOf(result)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGeneric(Exception ex) {
        log.error("Unhandled error", ex);
        return ResponseEntity
                .status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", "INTERNAL_ERROR", "message", getMessageOrCause(ex)));
    }

    /** Gateway's own code and message; duplicate-order rejections reach the caller verbatim. */
    private static String messageOf(GatewayOrderResult result) {
        String code = result.getErrorCode() != null ? result.getErrorCode() : "unknown";
        String message = result.getMessage() != null ? result.getMessage() : "no message";
        return code + ": " + message;
    }

    private static String getMessageOrCause(Throwable ex) {
        Throwable t = ex;
        while (t != null) {
            if (t.getMessage() != null && !t.getMessage().isBlank()) {
                return t.getMessage();
            }
            t = t.getCause();
        }
        return ex.getClass().getSimpleName();
    }
}
