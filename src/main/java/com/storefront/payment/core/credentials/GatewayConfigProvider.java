package com.storefront.payment.core.credentials;

import com.storefront.payment.domain.GatewayConfigSnapshot;

import java.util.Optional;

/**
 * Source of persisted gateway configuration. Implementations read the store's settings
 * record; an empty result means no record exists, not that the lookup failed.
 */
public interface GatewayConfigProvider {

    /**
     * Current settings record, or empty when none is stored.
     *
     * @throws com.storefront.payment.api.ConfigurationException if the store cannot be read
     */
    Optional<GatewayConfigSnapshot> getActiveConfig();
}
