package com.storefront.payment.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Authoritative order state as reported by the gateway.
 */
@Value
@Builder
public class OrderStatusView {

    String orderId;
    String cfOrderId;
    /** Raw gateway status; values outside {@link GatewayOrderStatus} are passed through. */
    String orderStatus;
    boolean paid;
    BigDecimal orderAmount;
    String orderCurrency;
    GatewayEnvironment environment;
}
