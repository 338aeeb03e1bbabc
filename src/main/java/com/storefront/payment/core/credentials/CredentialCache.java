package com.storefront.payment.core.credentials;

import com.storefront.payment.config.PaymentProperties;
import com.storefront.payment.domain.GatewayCredentials;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Short-lived holder for resolved credentials. Readers share one immutable entry;
 * {@link #invalidate()} drops it at once so a rotated credential is picked up on the next
 * request instead of after the TTL. Failed loads are never cached.
 */
@Slf4j
@Component
public class CredentialCache {

    private final AtomicReference<Entry> current = new AtomicReference<>();
    private final Duration ttl;
    private final Clock clock;

    @Autowired
    public CredentialCache(PaymentProperties properties, Clock clock) {
        this(properties.getCredentials().getCacheTtl(), clock);
    }

    CredentialCache(Duration ttl, Clock clock) {
        this.ttl = ttl == null ? Duration.ZERO : ttl;
        this.clock = clock;
    }

    /**
     * Cached credentials if still fresh, otherwise the result of {@code loader}. Concurrent
     * misses may each call the loader; the last one to finish wins.
     */
    public GatewayCredentials get(Supplier<GatewayCredentials> loader) {
        if (ttl.isZero() || ttl.isNegative()) {
            return loader.get();
        }
        Instant now = clock.instant();
        Entry entry = current.get();
        if (entry != null && now.isBefore(entry.expiresAt)) {
            return entry.credentials;
        }
        GatewayCredentials loaded = loader.get();
        current.set(new Entry(loaded, now.plus(ttl)));
        return loaded;
    }

    public void invalidate() {
        if (current.getAndSet(null) != null) {
            log.info("Gateway credential cache invalidated");
        }
    }

    private static final class Entry {
        private final GatewayCredentials credentials;
        private final Instant expiresAt;

        private Entry(GatewayCredentials credentials, Instant expiresAt) {
            this.credentials = credentials;
            this.expiresAt = expiresAt;
        }
    }
}
