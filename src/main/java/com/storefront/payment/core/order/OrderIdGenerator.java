package com.storefront.payment.core.order;

import com.storefront.payment.config.PaymentProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

/**
 * Generates merchant order ids of the form {@code {prefix}_{epochMillis}_{7 base-36 chars}},
 * which always satisfy the gateway's 3-45 character {@code [A-Za-z0-9_-]} rule for the default
 * prefix.
 */
@Component
public class OrderIdGenerator {

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int SUFFIX_LENGTH = 7;

    private final String prefix;
    private final Clock clock;
    private final Random random;

    @Autowired
    public OrderIdGenerator(PaymentProperties properties, Clock clock) {
        this(properties.getOrder().getIdPrefix(), clock, new SecureRandom());
    }

    OrderIdGenerator(String prefix, Clock clock, Random random) {
        this.prefix = prefix;
        this.clock = clock;
        this.random = random;
    }

    public String nextId() {
        return nextId(clock.millis());
    }

    /** Id for a build happening at {@code epochMillis}. */
    public String nextId(long epochMillis) {
        StringBuilder suffix = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            suffix.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return prefix + "_" + epochMillis + "_" + suffix;
    }
}
