package com.storefront.payment.api;

import com.storefront.payment.core.webhook.WebhookAck;
import com.storefront.payment.core.webhook.WebhookIngestor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives server-to-server notifications from the gateway. The raw body is taken as a
 * string because the signature covers the exact bytes sent. Always answers 200 so the
 * gateway does not keep redelivering; problems are logged and recorded instead.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments/webhook")
@RequiredArgsConstructor
@Tag(name = "Payment webhook", description = "Gateway notifications")
public class PaymentWebhookController {

    static final String SIGNATURE_HEADER = "x-webhook-signature";
    static final String TIMESTAMP_HEADER = "x-webhook-timestamp";

    private final WebhookIngestor ingestor;

    @PostMapping
    @Operation(summary = "Gateway notification", description = "Verifies the signature, records the notification and acks with 200.")
    public ResponseEntity<WebhookAck> receive(@RequestBody(required = false) String payload,
                                              @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
                                              @RequestHeader(value = TIMESTAMP_HEADER, required = false) String timestamp) {
        try {
            return ResponseEntity.ok(ingestor.ingest(payload, signature, timestamp));
        } catch (Exception e) {
            log.error("Webhook ingestion failed", e);
            return ResponseEntity.ok(WebhookAck.builder().received(true).processed(false).build());
        }
    }
}
