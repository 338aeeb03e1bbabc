package com.storefront.payment.core.credentials;

import com.storefront.payment.api.ConfigurationException;
import com.storefront.payment.config.PaymentProperties;
import com.storefront.payment.domain.GatewayConfigSnapshot;
import com.storefront.payment.persistence.entity.GatewayConfigEntity;
import com.storefront.payment.persistence.repository.GatewayConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Reads gateway settings from the {@code gateway_config} table.
 *
 * <p>A store that cannot be read fails closed: falling back to process configuration here
 * could re-enable a gateway the stored record disables.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PersistentGatewayConfigProvider implements GatewayConfigProvider {

    private final GatewayConfigRepository repository;
    private final PaymentProperties properties;

    @Override
    @Transactional(readOnly = true)
    public Optional<GatewayConfigSnapshot> getActiveConfig() {
        String configName = properties.getCredentials().getConfigName();
        try {
            return repository.findByConfigNameAndActiveTrue(configName).map(this::toSnapshot);
        } catch (Exception e) {
            log.error("Gateway configuration store lookup failed for configName={}", configName, e);
            throw new ConfigurationException(ConfigurationException.Reason.CONFIG_MISSING,
                    "Gateway configuration store is unavailable", e);
        }
    }

    private GatewayConfigSnapshot toSnapshot(GatewayConfigEntity entity) {
        return GatewayConfigSnapshot.builder()
                .clientId(entity.getClientId())
                .clientSecret(entity.getClientSecret())
                .environment(entity.getEnvironment())
                .enabled(entity.isEnabled())
                .source("store")
                .build();
    }
}
