package com.storefront.payment.core.credentials;

import com.storefront.payment.api.ConfigurationException;
import com.storefront.payment.domain.GatewayConfigSnapshot;
import com.storefront.payment.domain.GatewayCredentials;
import com.storefront.payment.domain.GatewayEnvironment;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Produces the gateway credentials for the current request.
 *
 * <p>The stored settings record wins over process configuration; a blank credential field in
 * the record falls back to the process value for that field only. When a record exists its
 * {@code enabled} flag is authoritative. Every failure path throws
 * {@link ConfigurationException} so no gateway call is attempted.</p>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialResolver {

    private final GatewayConfigProvider configProvider;
    private final ProcessGatewayConfigSource processSource;
    private final CredentialCache cache;

    public GatewayCredentials resolve() {
        return cache.get(this::load);
    }

    /** Drops cached credentials so the next {@link #resolve()} re-reads every source. */
    public void invalidate() {
        cache.invalidate();
    }

    private GatewayCredentials load() {
        Optional<GatewayConfigSnapshot> stored = configProvider.getActiveConfig();
        Optional<GatewayConfigSnapshot> process = processSource.read();

        if (stored.isEmpty() && process.isEmpty()) {
            log.warn("No gateway configuration found in store or process environment");
            throw new ConfigurationException(ConfigurationException.Reason.CONFIG_MISSING,
                    "Payment gateway is not configured");
        }

        GatewayConfigSnapshot primary = stored.orElseGet(process::get);
        GatewayConfigSnapshot fallback = stored.isPresent() ? process.orElse(null) : null;

        boolean enabled = primary.getEnabled() == null || primary.getEnabled();
        if (!enabled) {
            log.warn("Payment gateway disabled by {} configuration", primary.getSource());
            throw new ConfigurationException(ConfigurationException.Reason.DISABLED,
                    "Payment gateway is disabled");
        }

        String clientId = firstNonBlank(primary.getClientId(), fallback == null ? null : fallback.getClientId());
        String clientSecret = firstNonBlank(primary.getClientSecret(), fallback == null ? null : fallback.getClientSecret());
        if (clientId == null || clientSecret == null) {
            log.warn("Gateway credentials incomplete: clientIdPresent={} clientSecretPresent={} source={}",
                    clientId != null, clientSecret != null, primary.getSource());
            throw new ConfigurationException(ConfigurationException.Reason.CONFIG_MISSING,
                    "Payment gateway credentials are incomplete");
        }

        String rawEnvironment = firstNonBlank(primary.getEnvironment(), fallback == null ? null : fallback.getEnvironment());
        GatewayEnvironment environment = GatewayEnvironment.parse(rawEnvironment)
                .orElseThrow(() -> {
                    log.warn("Unrecognized gateway environment '{}' from {} configuration",
                            rawEnvironment, primary.getSource());
                    return new ConfigurationException(ConfigurationException.Reason.INVALID_ENVIRONMENT,
                            "Unrecognized payment gateway environment: " + rawEnvironment);
                });

        log.info("Resolved gateway credentials: source={} environment={}", primary.getSource(), environment);
        return GatewayCredentials.builder()
                .clientId(clientId)
                .clientSecret(clientSecret)
                .environment(environment)
                .enabled(true)
                .build();
    }

    private static String firstNonBlank(String preferred, String fallback) {
        if (preferred != null && !preferred.isBlank()) {
            return preferred.trim();
        }
        if (fallback != null && !fallback.isBlank()) {
            return fallback.trim();
        }
        return null;
    }
}
