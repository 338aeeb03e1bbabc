package com.storefront.payment.core.credentials;

import com.storefront.payment.domain.GatewayConfigSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gateway settings from process configuration (environment variables, system properties).
 *
 * <p>Canonical keys are {@code CASHFREE_CLIENT_ID}, {@code CASHFREE_CLIENT_SECRET},
 * {@code CASHFREE_ENVIRONMENT} and {@code CASHFREE_ENABLED}. The older names
 * {@code CASHFREE_APP_ID}, {@code CASHFREE_SECRET_KEY} and {@code CASHFREE_ENV} are still
 * read when the canonical key is unset, with a one-time warning per key.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProcessGatewayConfigSource {

    public static final String CLIENT_ID = "CASHFREE_CLIENT_ID";
    public static final String CLIENT_SECRET = "CASHFREE_CLIENT_SECRET";
    public static final String ENVIRONMENT = "CASHFREE_ENVIRONMENT";
    public static final String ENABLED = "CASHFREE_ENABLED";

    private static final Map<String, String> DEPRECATED_ALIASES = Map.of(
            CLIENT_ID, "CASHFREE_APP_ID",
            CLIENT_SECRET, "CASHFREE_SECRET_KEY",
            ENVIRONMENT, "CASHFREE_ENV");

    private final Environment environment;
    private final Set<String> warnedAliases = ConcurrentHashMap.newKeySet();

    /**
     * Settings from the process, or empty when none of the keys (or aliases) is set.
     */
    public Optional<GatewayConfigSnapshot> read() {
        String clientId = lookup(CLIENT_ID);
        String clientSecret = lookup(CLIENT_SECRET);
        String env = lookup(ENVIRONMENT);
        String enabled = lookup(ENABLED);
        if (clientId == null && clientSecret == null && env == null && enabled == null) {
            return Optional.empty();
        }
        return Optional.of(GatewayConfigSnapshot.builder()
                .clientId(clientId)
                .clientSecret(clientSecret)
                .environment(env)
                .enabled(enabled == null ? null : Boolean.parseBoolean(enabled.trim()))
                .source("process")
                .build());
    }

    /** Single key with its deprecated alias as fallback. */
    String lookup(String key) {
        String value = environment.getProperty(key);
        if (value != null && !value.isBlank()) {
            return value;
        }
        String alias = DEPRECATED_ALIASES.get(key);
        if (alias == null) {
            return null;
        }
        String aliased = environment.getProperty(alias);
        if (aliased != null && !aliased.isBlank()) {
            if (warnedAliases.add(alias)) {
                log.warn("Process configuration uses deprecated key {}; rename it to {}", alias, key);
            }
            return aliased;
        }
        return null;
    }
}
