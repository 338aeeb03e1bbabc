package com.storefront.payment.core.webhook;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class WebhookSignatureVerifierTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String SECRET = "whsec_test";
    private static final String BODY = "{\"type\":\"PAYMENT_SUCCESS_WEBHOOK\"}";

    private final WebhookSignatureVerifier verifier =
            new WebhookSignatureVerifier(Duration.ofMinutes(5), Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void acceptsSignatureOverTimestampAndBody() {
        String timestamp = String.valueOf(NOW.getEpochSecond());
        String signature = verifier.sign(timestamp + BODY, SECRET);

        assertThat(verifier.verify(BODY, signature, timestamp, SECRET)).isTrue();
    }

    @Test
    void acceptsMillisecondTimestamps() {
        String timestamp = String.valueOf(NOW.minusSeconds(30).toEpochMilli());
        String signature = verifier.sign(timestamp + BODY, SECRET);

        assertThat(verifier.verify(BODY, signature, timestamp, SECRET)).isTrue();
    }

    @Test
    void rejectsTamperedBody() {
        String timestamp = String.valueOf(NOW.getEpochSecond());
        String signature = verifier.sign(timestamp + BODY, SECRET);

        assertThat(verifier.verify(BODY + " ", signature, timestamp, SECRET)).isFalse();
    }

    @Test
    void rejectsWrongSecret() {
        String timestamp = String.valueOf(NOW.getEpochSecond());
        String signature = verifier.sign(timestamp + BODY, "other");

        assertThat(verifier.verify(BODY, signature, timestamp, SECRET)).isFalse();
    }

    @Test
    void rejectsStaleTimestamp() {
        String timestamp = String.valueOf(NOW.minus(Duration.ofMinutes(6)).getEpochSecond());
        String signature = verifier.sign(timestamp + BODY, SECRET);

        assertThat(verifier.verify(BODY, signature, timestamp, SECRET)).isFalse();
    }

    @Test
    void rejectsMissingHeadersAndSecret() {
        String timestamp = String.valueOf(NOW.getEpochSecond());
        String signature = verifier.sign(timestamp + BODY, SECRET);

        assertThat(verifier.verify(BODY, null, timestamp, SECRET)).isFalse();
        assertThat(verifier.verify(BODY, signature, " ", SECRET)).isFalse();
        assertThat(verifier.verify(BODY, signature, timestamp, null)).isFalse();
        assertThat(verifier.verify(BODY, signature, "yesterday", SECRET)).isFalse();
    }
}
