package com.storefront.payment.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Where to send the shopper after a return callback, and whether payment was confirmed
 * with the gateway.
 */
@Value
@Builder
public class FinalOutcome {

    /** Absolute storefront URL for the 302 Location header. */
    String redirectTarget;

    /** True only when the gateway itself reported the order PAID. */
    boolean verified;

    /** True when the shopper is sent to the success page. */
    boolean success;

    String orderId;

    /** Machine-readable reason for a failure redirect. */
    String reason;
}
