package com.storefront.payment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the storefront payment gateway adapter. Provides:
 * <ul>
 *   <li>Gateway order creation with environment-correct callback URLs</li>
 *   <li>Verified handling of the shopper's return from the hosted checkout</li>
 *   <li>Signed webhook ingestion, recorded in PostgreSQL and de-duplicated in Redis</li>
 *   <li>Kafka lifecycle events and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class StorefrontPaymentApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorefrontPaymentApplication.class, args);
    }
}
