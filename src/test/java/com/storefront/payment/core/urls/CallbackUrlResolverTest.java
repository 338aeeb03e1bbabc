package com.storefront.payment.core.urls;

import com.storefront.payment.config.PaymentProperties;
import com.storefront.payment.domain.CallbackUrls;
import com.storefront.payment.domain.GatewayEnvironment;
import com.storefront.payment.domain.RequestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CallbackUrlResolverTest {

    private PaymentProperties properties;
    private CallbackUrlResolver resolver;

    @BeforeEach
    void setUp() {
        properties = new PaymentProperties();
        resolver = new CallbackUrlResolver(properties);
    }

    @Test
    void liveEnvironmentForcesHttpsReturnUrl() {
        RequestContext context = RequestContext.builder()
                .scheme("http")
                .hostHeader("shop.example.com")
                .build();

        CallbackUrls urls = resolver.callbackUrls(context, GatewayEnvironment.LIVE);

        assertThat(urls.getReturnUrl())
                .isEqualTo("https://shop.example.com/api/v1/payments/return?order_id={order_id}");
        assertThat(urls.getNotifyUrl()).isEqualTo("https://shop.example.com/api/v1/payments/webhook");
    }

    @Test
    void sandboxKeepsInboundScheme() {
        RequestContext context = RequestContext.builder()
                .scheme("http")
                .hostHeader("shop.example.com:8080")
                .build();

        assertThat(resolver.resolveServerUrl(context, GatewayEnvironment.SANDBOX))
                .isEqualTo("http://shop.example.com:8080");
    }

    @Test
    void forwardedHeadersTakePrecedenceAndOnlyFirstValueCounts() {
        RequestContext context = RequestContext.builder()
                .scheme("http")
                .hostHeader("internal:5001")
                .forwardedProto("https, http")
                .forwardedHost("shop.example.com, proxy.local")
                .build();

        assertThat(resolver.resolveServerUrl(context, GatewayEnvironment.SANDBOX))
                .isEqualTo("https://shop.example.com");
    }

    @Test
    void loopbackSwapsBackendPortForStorefrontUrl() {
        RequestContext context = RequestContext.builder()
                .scheme("http")
                .hostHeader("localhost:5001")
                .build();

        assertThat(resolver.resolveClientUrl(context, GatewayEnvironment.SANDBOX)).isEqualTo("http://localhost:3000");
        assertThat(resolver.resolveServerUrl(context, GatewayEnvironment.SANDBOX)).isEqualTo("http://localhost:5001");
    }

    @Test
    void loopbackSwapsStorefrontPortForServerUrl() {
        RequestContext context = RequestContext.builder()
                .scheme("http")
                .hostHeader("127.0.0.1:3000")
                .build();

        assertThat(resolver.resolveServerUrl(context, GatewayEnvironment.SANDBOX)).isEqualTo("http://127.0.0.1:5001");
    }

    @Test
    void ipv6LoopbackIsRecognised() {
        RequestContext context = RequestContext.builder()
                .scheme("http")
                .hostHeader("[::1]:5001")
                .build();

        assertThat(resolver.resolveClientUrl(context, GatewayEnvironment.SANDBOX)).isEqualTo("http://[::1]:3000");
    }

    @Test
    void nonLoopbackPortIsKept() {
        RequestContext context = RequestContext.builder()
                .scheme("http")
                .hostHeader("staging.example.com:5001")
                .build();

        assertThat(resolver.resolveClientUrl(context, GatewayEnvironment.SANDBOX))
                .isEqualTo("http://staging.example.com:5001");
    }

    @Test
    void fallsBackToServerNameAndPort() {
        RequestContext context = RequestContext.builder()
                .scheme("http")
                .serverName("10.0.0.5")
                .serverPort(8080)
                .build();

        assertThat(resolver.resolveServerUrl(context, GatewayEnvironment.SANDBOX)).isEqualTo("http://10.0.0.5:8080");
    }

    @Test
    void explicitOverrideWinsAndLosesTrailingSlash() {
        properties.getUrls().setClientBaseUrl("http://shop.example.com/");
        RequestContext context = RequestContext.builder().scheme("http").hostHeader("localhost:5001").build();

        assertThat(resolver.resolveClientUrl(context, GatewayEnvironment.SANDBOX)).isEqualTo("http://shop.example.com");
        assertThat(resolver.resolveClientUrl(context, GatewayEnvironment.LIVE)).isEqualTo("https://shop.example.com");
    }

    @Test
    void autoOverrideMeansDetect() {
        properties.getUrls().setServerBaseUrl("AUTO");
        RequestContext context = RequestContext.builder().scheme("https").hostHeader("api.example.com").build();

        assertThat(resolver.resolveServerUrl(context, GatewayEnvironment.SANDBOX)).isEqualTo("https://api.example.com");
    }
}
