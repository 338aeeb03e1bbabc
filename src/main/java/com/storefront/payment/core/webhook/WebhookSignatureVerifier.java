package com.storefront.payment.core.webhook;

import com.storefront.payment.config.PaymentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;

/**
 * Checks a gateway notification's {@code x-webhook-signature}, which is
 * {@code Base64(HMAC-SHA256(timestamp + rawBody))} keyed with the shared secret, and rejects
 * notifications whose {@code x-webhook-timestamp} is outside the tolerance window.
 */
@Slf4j
@Component
public class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";
    /** Timestamps above this are epoch milliseconds, below it epoch seconds. */
    private static final long MILLIS_THRESHOLD = 100_000_000_000L;

    private final Duration tolerance;
    private final Clock clock;

    @Autowired
    public WebhookSignatureVerifier(PaymentProperties properties, Clock clock) {
        this(properties.getWebhook().getTimestampTolerance(), clock);
    }

    WebhookSignatureVerifier(Duration tolerance, Clock clock) {
        this.tolerance = tolerance;
        this.clock = clock;
    }

    public boolean verify(String rawBody, String signature, String timestamp, String secret) {
        if (signature == null || signature.isBlank() || timestamp == null || timestamp.isBlank()) {
            log.warn("Webhook rejected: signature or timestamp header missing");
            return false;
        }
        if (secret == null || secret.isBlank()) {
            log.error("Webhook rejected: no signing secret available");
            return false;
        }
        if (!withinTolerance(timestamp.trim())) {
            return false;
        }
        byte[] expected = sign(timestamp.trim() + (rawBody == null ? "" : rawBody), secret)
                .getBytes(StandardCharsets.UTF_8);
        boolean valid = MessageDigest.isEqual(expected, signature.trim().getBytes(StandardCharsets.UTF_8));
        if (!valid) {
            log.warn("Webhook rejected: signature mismatch");
        }
        return valid;
    }

    /** Signature the gateway would send for {@code payload}. */
    public String sign(String payload, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return Base64.getEncoder().encodeToString(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 not available", e);
        }
    }

    private boolean withinTolerance(String timestamp) {
        long value;
        try {
            value = Long.parseLong(timestamp);
        } catch (NumberFormatException e) {
            log.warn("Webhook rejected: unparseable timestamp '{}'", timestamp);
            return false;
        }
        Instant signedAt = value > MILLIS_THRESHOLD ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
        Duration age = Duration.between(signedAt, clock.instant()).abs();
        if (age.compareTo(tolerance) > 0) {
            log.warn("Webhook rejected: timestamp outside tolerance (age={}, tolerance={})", age, tolerance);
            return false;
        }
        return true;
    }
}
