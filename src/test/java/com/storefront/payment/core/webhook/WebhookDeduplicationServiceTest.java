package com.storefront.payment.core.webhook;

import com.storefront.payment.config.PaymentProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookDeduplicationServiceTest {

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    private WebhookDeduplicationService service;

    @BeforeEach
    void setUp() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        service = new WebhookDeduplicationService(redisTemplate, new PaymentProperties());
    }

    @Test
    void firstDeliverySetsMarkerWithTtl() {
        when(valueOperations.setIfAbsent("payment:webhook:abc", "1", Duration.ofHours(24))).thenReturn(true);

        assertThat(service.markFirstDelivery("abc")).isTrue();
    }

    @Test
    void redeliveryIsDetected() {
        when(valueOperations.setIfAbsent(eq("payment:webhook:abc"), anyString(), any(Duration.class)))
                .thenReturn(false);

        assertThat(service.markFirstDelivery("abc")).isFalse();
    }

    @Test
    void redisFailureTreatsDeliveryAsNew() {
        when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenThrow(new RedisConnectionFailureException("down"));

        assertThat(service.markFirstDelivery("abc")).isTrue();
    }
}
