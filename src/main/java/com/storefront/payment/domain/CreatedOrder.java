package com.storefront.payment.domain;

import lombok.Builder;
import lombok.Value;

/**
 * A gateway order created for a checkout, with what the storefront needs to open the
 * hosted checkout page.
 */
@Value
@Builder
public class CreatedOrder {

    String orderId;
    String cfOrderId;
    String paymentSessionId;
    String orderStatus;
    GatewayEnvironment environment;
    String returnUrl;
}
