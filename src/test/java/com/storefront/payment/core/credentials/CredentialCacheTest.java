package com.storefront.payment.core.credentials;

import com.storefront.payment.api.ConfigurationException;
import com.storefront.payment.domain.GatewayCredentials;
import com.storefront.payment.domain.GatewayEnvironment;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CredentialCacheTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private final AtomicInteger loads = new AtomicInteger();

    @Test
    void reusesValueWithinTtl() {
        MutableClock clock = new MutableClock(NOW);
        CredentialCache cache = new CredentialCache(Duration.ofSeconds(60), clock);

        cache.get(loader());
        clock.advance(Duration.ofSeconds(30));
        cache.get(loader());

        assertThat(loads.get()).isEqualTo(1);
    }

    @Test
    void reloadsAfterTtl() {
        MutableClock clock = new MutableClock(NOW);
        CredentialCache cache = new CredentialCache(Duration.ofSeconds(60), clock);

        cache.get(loader());
        clock.advance(Duration.ofSeconds(61));
        cache.get(loader());

        assertThat(loads.get()).isEqualTo(2);
    }

    @Test
    void invalidateForcesReload() {
        CredentialCache cache = new CredentialCache(Duration.ofMinutes(5), new MutableClock(NOW));

        cache.get(loader());
        cache.invalidate();
        cache.get(loader());

        assertThat(loads.get()).isEqualTo(2);
    }

    @Test
    void zeroTtlDisablesCaching() {
        CredentialCache cache = new CredentialCache(Duration.ZERO, new MutableClock(NOW));

        cache.get(loader());
        cache.get(loader());

        assertThat(loads.get()).isEqualTo(2);
    }

    @Test
    void failuresAreNotCached() {
        CredentialCache cache = new CredentialCache(Duration.ofMinutes(5), new MutableClock(NOW));

        assertThatThrownBy(() -> cache.get(() -> {
            loads.incrementAndGet();
            throw new ConfigurationException(ConfigurationException.Reason.DISABLED, "disabled");
        })).isInstanceOf(ConfigurationException.class);
        GatewayCredentials credentials = cache.get(loader());

        assertThat(credentials.getClientId()).isEqualTo("id-2");
    }

    private Supplier<GatewayCredentials> loader() {
        return () -> GatewayCredentials.builder()
                .clientId("id-" + loads.incrementAndGet())
                .clientSecret("secret")
                .environment(GatewayEnvironment.SANDBOX)
                .enabled(true)
                .build();
    }

    static final class MutableClock extends Clock {
        private Instant instant;

        MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
