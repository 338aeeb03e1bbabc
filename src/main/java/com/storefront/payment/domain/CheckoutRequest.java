package com.storefront.payment.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Checkout input handed to the order payload builder. Nothing here has been validated yet.
 */
@Value
@Builder
public class CheckoutRequest {

    BigDecimal amount;

    /** ISO 4217 code; INR when absent. */
    String currency;

    CustomerDetails customer;

    String orderNote;

    /** Merchant order id; generated when absent. */
    String orderId;

    /** Expiry requested by the caller; 24 hours out when absent. */
    OffsetDateTime orderExpiryTime;

    /** Comma-separated payment method codes offered on the hosted checkout page. */
    String paymentMethods;

    Map<String, String> orderTags;
}
