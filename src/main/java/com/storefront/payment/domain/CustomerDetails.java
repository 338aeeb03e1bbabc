package com.storefront.payment.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Shopper identity supplied by the checkout flow. Phone is mandatory; the rest is optional.
 */
@Value
@Builder
public class CustomerDetails {

    /** Stable customer id; derived from phone/email when absent. */
    String customerId;
    String phone;
    String email;
    String name;
}
