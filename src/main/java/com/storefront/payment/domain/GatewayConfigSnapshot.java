package com.storefront.payment.domain;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Raw gateway configuration as read from one source (configuration store or process
 * environment), before validation. Any field may be null.
 */
@Value
@Builder
public class GatewayConfigSnapshot {

    String clientId;

    @ToString.Exclude
    String clientSecret;

    String environment;

    Boolean enabled;

    /** Where the values came from, for logs: "store" or "process". */
    String source;
}
