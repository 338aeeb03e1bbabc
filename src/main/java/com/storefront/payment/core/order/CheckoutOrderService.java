package com.storefront.payment.core.order;

import com.fasterxml.jackson.databind.JsonNode;
import com.storefront.payment.api.ConfigurationException;
import com.storefront.payment.api.GatewayRequestException;
import com.storefront.payment.compliance.PaymentAuditLogger;
import com.storefront.payment.core.PaymentGatewayClient;
import com.storefront.payment.core.credentials.CredentialResolver;
import com.storefront.payment.core.urls.CallbackUrlResolver;
import com.storefront.payment.domain.CallbackUrls;
import com.storefront.payment.domain.CheckoutRequest;
import com.storefront.payment.domain.CreatedOrder;
import com.storefront.payment.domain.GatewayCredentials;
import com.storefront.payment.domain.GatewayOrderResult;
import com.storefront.payment.domain.GatewayOrderStatus;
import com.storefront.payment.domain.OrderPayload;
import com.storefront.payment.domain.OrderStatusView;
import com.storefront.payment.domain.PaymentConfigView;
import com.storefront.payment.domain.RequestContext;
import com.storefront.payment.messaging.PaymentLifecycleEventProducer;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Checkout-side order flow: resolve credentials, work out callback URLs, build and validate
 * the payload, then create the order with the gateway.
 *
 * <p>Credentials are resolved before anything else so a disabled or unconfigured gateway
 * fails without network I/O. Gateway calls go through the caller-level retry, which only
 * repeats transport failures and rate limiting.</p>
 */
@Slf4j
@Service
public class CheckoutOrderService {

    private final CredentialResolver credentialResolver;
    private final CallbackUrlResolver callbackUrlResolver;
    private final OrderPayloadBuilder payloadBuilder;
    private final PaymentGatewayClient gatewayClient;
    private final Retry gatewayRetry;
    private final PaymentAuditLogger auditLogger;
    private final PaymentLifecycleEventProducer eventProducer;

    public CheckoutOrderService(CredentialResolver credentialResolver,
                                CallbackUrlResolver callbackUrlResolver,
                                OrderPayloadBuilder payloadBuilder,
                                PaymentGatewayClient gatewayClient,
                                @Qualifier("gatewayRetry") Retry gatewayRetry,
                                PaymentAuditLogger auditLogger,
                                PaymentLifecycleEventProducer eventProducer) {
        this.credentialResolver = credentialResolver;
        this.callbackUrlResolver = callbackUrlResolver;
        this.payloadBuilder = payloadBuilder;
        this.gatewayClient = gatewayClient;
        this.gatewayRetry = gatewayRetry;
        this.auditLogger = auditLogger;
        this.eventProducer = eventProducer;
    }

    public CreatedOrder createOrder(CheckoutRequest request, RequestContext context) {
        GatewayCredentials credentials = credentialResolver.resolve();
        CallbackUrls callbackUrls = callbackUrlResolver.callbackUrls(context, credentials.getEnvironment());
        OrderPayload payload = payloadBuilder.build(request, credentials, callbackUrls);
        auditLogger.logOrderRequest(payload);

        GatewayOrderResult result = gatewayRetry.executeSupplier(
                () -> gatewayClient.createOrder(payload, credentials));
        if (!result.isOk()) {
            auditLogger.logOrderFailed(payload.getOrderId(),
                    result.getOutcome() + " " + (result.getErrorCode() != null
                            ? result.getErrorCode() : result.getTransportErrorKind()));
            throw new GatewayRequestException("Order creation", result);
        }

        CreatedOrder order = CreatedOrder.builder()
                .orderId(result.bodyText("order_id").orElse(payload.getOrderId()))
                .cfOrderId(result.bodyText("cf_order_id").orElse(null))
                .paymentSessionId(result.bodyText("payment_session_id").orElse(null))
                .orderStatus(result.rawOrderStatus().orElse(GatewayOrderStatus.ACTIVE.name()))
                .environment(credentials.getEnvironment())
                .returnUrl(callbackUrls.getReturnUrl())
                .build();
        if (order.getPaymentSessionId() == null) {
            log.warn("Gateway created order without payment_session_id: orderId={}", order.getOrderId());
        }
        auditLogger.logOrderCreated(order);
        eventProducer.publishCreated(order);
        return order;
    }

    /**
     * Current gateway state of {@code orderId}.
     *
     * @throws GatewayRequestException if the gateway could not be asked or rejected the lookup
     */
    public OrderStatusView verify(String orderId) {
        GatewayCredentials credentials = credentialResolver.resolve();
        GatewayOrderResult result = gatewayRetry.executeSupplier(
                () -> gatewayClient.getOrderStatus(orderId, credentials));
        if (!result.isOk()) {
            throw new GatewayRequestException("Order status lookup", result);
        }
        String status = result.rawOrderStatus().orElse(null);
        return OrderStatusView.builder()
                .orderId(result.bodyText("order_id").orElse(orderId))
                .cfOrderId(result.bodyText("cf_order_id").orElse(null))
                .orderStatus(status)
                .paid(result.orderStatus().filter(s -> s == GatewayOrderStatus.PAID).isPresent())
                .orderAmount(decimal(result.getBody(), "order_amount"))
                .orderCurrency(result.bodyText("order_currency").orElse(null))
                .environment(credentials.getEnvironment())
                .build();
    }

    /** Non-sensitive view of the gateway configuration. Never throws. */
    public PaymentConfigView describeConfiguration() {
        try {
            GatewayCredentials credentials = credentialResolver.resolve();
            return PaymentConfigView.builder()
                    .enabled(true)
                    .environment(credentials.getEnvironment())
                    .configured(true)
                    .build();
        } catch (ConfigurationException e) {
            log.info("Gateway configuration unavailable: reason={} message={}", e.getReason(), e.getMessage());
            return PaymentConfigView.builder()
                    .enabled(false)
                    .configured(e.getReason() != ConfigurationException.Reason.CONFIG_MISSING)
                    .build();
        } catch (Exception e) {
            log.error("Unexpected error while describing gateway configuration", e);
            return PaymentConfigView.builder().enabled(false).configured(false).build();
        }
    }

    private static BigDecimal decimal(JsonNode body, String field) {
        if (body == null || body.get(field) == null || !body.get(field).isNumber()) {
            return null;
        }
        return body.get(field).decimalValue();
    }
}
