package com.storefront.payment.core;

import com.storefront.payment.domain.GatewayCredentials;
import com.storefront.payment.domain.GatewayOrderResult;
import com.storefront.payment.domain.OrderPayload;

/**
 * Talks to the hosted-checkout gateway's order API and gives back a normalized result.
 * Implementations never retry and never throw for gateway or transport failures; those come
 * back as {@link GatewayOrderResult} so the caller decides whether to retry.
 */
public interface PaymentGatewayClient {

    /**
     * Create a gateway order.
     *
     * @throws com.storefront.payment.api.ConfigurationException if the credentials are not usable;
     *         no request is sent in that case
     */
    GatewayOrderResult createOrder(OrderPayload payload, GatewayCredentials credentials);

    /**
     * Fetch the authoritative state of an order.
     *
     * @throws com.storefront.payment.api.ConfigurationException if the credentials are not usable
     */
    GatewayOrderResult getOrderStatus(String orderId, GatewayCredentials credentials);
}
