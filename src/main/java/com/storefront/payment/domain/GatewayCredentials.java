package com.storefront.payment.domain;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Resolved credentials for one gateway account. Instances handed out by the credential
 * resolver are always enabled and carry non-blank, trimmed credentials.
 */
@Value
@Builder
public class GatewayCredentials {

    String clientId;

    @ToString.Exclude
    String clientSecret;

    GatewayEnvironment environment;

    boolean enabled;

    /** True when these credentials may be sent to the gateway. */
    public boolean isUsable() {
        return enabled
                && environment != null
                && clientId != null && !clientId.isBlank()
                && clientSecret != null && !clientSecret.isBlank();
    }
}
