package com.storefront.payment.config;

import com.storefront.payment.domain.GatewayOrderResult;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Wiring for the gateway adapter: HTTP client with bounded timeouts, caller-level retry,
 * webhook executor and the clock used for ids and expiry.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(PaymentProperties.class)
public class PaymentConfig {

    public static final String GATEWAY_RETRY = "gateway";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "gatewayRestTemplate")
    public RestTemplate gatewayRestTemplate(PaymentProperties properties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) properties.getGateway().getConnectTimeout().toMillis());
        factory.setReadTimeout((int) properties.getGateway().getReadTimeout().toMillis());
        RestTemplate restTemplate = new RestTemplate();
        restTemplate.setRequestFactory(factory);
        log.info("Gateway HTTP client configured: connectTimeout={} readTimeout={}",
                properties.getGateway().getConnectTimeout(), properties.getGateway().getReadTimeout());
        return restTemplate;
    }

    /**
     * Retry for gateway calls. Only retryable results (transport errors, rate limiting) are
     * retried, with exponential backoff; exceptions such as configuration errors are not.
     */
    @Bean(name = "gatewayRetry")
    public Retry gatewayRetry(RetryRegistry retryRegistry, PaymentProperties properties) {
        PaymentProperties.Retry cfg = properties.getRetry();
        RetryConfig config = RetryConfig.<GatewayOrderResult>custom()
                .maxAttempts(Math.max(1, cfg.getMaxAttempts()))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        cfg.getInitialBackoff().toMillis(), cfg.getBackoffMultiplier()))
                .retryOnResult(GatewayOrderResult::isRetryable)
                .retryOnException(e -> false)
                .build();
        Retry retry = retryRegistry.retry(GATEWAY_RETRY, config);
        retry.getEventPublisher().onRetry(event ->
                log.warn("Retrying gateway call: attempt={} waitInterval={}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval()));
        return retry;
    }

    @Bean(name = "webhookExecutor")
    public Executor webhookExecutor(PaymentProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getWebhook().getExecutorThreads());
        executor.setMaxPoolSize(properties.getWebhook().getExecutorThreads());
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("webhook-");
        executor.initialize();
        return executor;
    }
}
