package com.storefront.payment.domain;

import lombok.Builder;
import lombok.Value;

/**
 * What the storefront may know about gateway configuration. Never carries credentials.
 */
@Value
@Builder
public class PaymentConfigView {

    boolean enabled;
    /** Null when credentials could not be resolved. */
    GatewayEnvironment environment;
    boolean configured;
}
