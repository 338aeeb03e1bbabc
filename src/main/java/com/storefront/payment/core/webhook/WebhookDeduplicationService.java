package com.storefront.payment.core.webhook;

import com.storefront.payment.config.PaymentProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Drops redelivered gateway notifications using a Redis marker per body hash. When Redis is
 * unavailable every notification is treated as new; the database's unique constraint is the
 * backstop.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookDeduplicationService {

    static final String KEY_PREFIX = "payment:webhook:";

    private final StringRedisTemplate redisTemplate;
    private final PaymentProperties properties;

    /**
     * @return true the first time {@code bodyHash} is seen within the dedup window
     */
    public boolean markFirstDelivery(String bodyHash) {
        String key = KEY_PREFIX + bodyHash;
        try {
            Boolean first = redisTemplate.opsForValue()
                    .setIfAbsent(key, "1", properties.getWebhook().getDedupTtl());
            if (Boolean.FALSE.equals(first)) {
                log.info("Duplicate webhook delivery ignored: key={}", key);
                return false;
            }
            return true;
        } catch (Exception e) {
            log.warn("Webhook dedup check failed for key={} (Redis unavailable), processing anyway: {}",
                    key, e.getMessage());
            return true;
        }
    }
}
