package com.storefront.payment.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the payment gateway adapter, bound from {@code payment.*}.
 *
 * <p>Gateway credentials are deliberately absent: they come from the configuration store or
 * the process environment through {@code CredentialResolver}.</p>
 */
@ConfigurationProperties(prefix = "payment")
@Getter
@Setter
public class PaymentProperties {

    private final Gateway gateway = new Gateway();
    private final Credentials credentials = new Credentials();
    private final Order order = new Order();
    private final Urls urls = new Urls();
    private final Retry retry = new Retry();
    private final Webhook webhook = new Webhook();

    @Getter
    @Setter
    public static class Gateway {
        /**
         * Order API base for sandbox credentials.
         */
        private String sandboxBaseUrl = "https://sandbox.cashfree.com/pg";

        /**
         * Order API base for live credentials.
         */
        private String liveBaseUrl = "https://api.cashfree.com/pg";

        /**
         * Value of the x-api-version header.
         */
        private String apiVersion = "2025-01-01";

        private Duration connectTimeout = Duration.ofSeconds(5);

        private Duration readTimeout = Duration.ofSeconds(15);

        /**
         * Hosts whose Referer header marks a browser return as coming from the gateway.
         */
        private List<String> refererHosts = new ArrayList<>(List.of("cashfree.com"));
    }

    @Getter
    @Setter
    public static class Credentials {
        /**
         * Name of the configuration-store record holding gateway credentials.
         */
        private String configName = "default";

        /**
         * How long resolved credentials are reused. Zero disables caching.
         */
        private Duration cacheTtl = Duration.ofSeconds(60);
    }

    @Getter
    @Setter
    public static class Order {
        private BigDecimal minAmount = new BigDecimal("1.00");

        /**
         * Per-transaction ceiling.
         */
        private BigDecimal maxAmount = new BigDecimal("999999");

        private String idPrefix = "order";

        /**
         * Mixed into the customer-id hash so ids are not a bare hash of the phone number.
         */
        private String customerIdSalt = "";

        private Duration expiry = Duration.ofHours(24);

        private String defaultNote = "Payment for order";

        private String paymentMethods = "cc,dc,nb,upi";
    }

    @Getter
    @Setter
    public static class Urls {
        /**
         * Storefront base URL; "auto" or blank derives it from the request.
         */
        private String clientBaseUrl = "auto";

        /**
         * Backend base URL; "auto" or blank derives it from the request.
         */
        private String serverBaseUrl = "auto";

        /**
         * Port the storefront dev server listens on for loopback hosts.
         */
        private int frontendPort = 3000;

        /**
         * Port this backend listens on for loopback hosts.
         */
        private int backendPort = 5001;

        /**
         * Return path; the gateway substitutes {order_id}.
         */
        private String returnPath = "/api/v1/payments/return?order_id={order_id}";

        private String notifyPath = "/api/v1/payments/webhook";
    }

    @Getter
    @Setter
    public static class Retry {
        /**
         * Total attempts per gateway call, first call included.
         */
        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofMillis(500);

        private double backoffMultiplier = 2.0;
    }

    @Getter
    @Setter
    public static class Webhook {
        /**
         * Shared secret for notification signatures; the client secret is used when blank.
         */
        private String secret = "";

        /**
         * Maximum age of a notification's signed timestamp.
         */
        private Duration timestampTolerance = Duration.ofMinutes(5);

        private Duration dedupTtl = Duration.ofHours(24);

        private int executorThreads = 4;
    }
}
