package com.storefront.payment.api;

import com.storefront.payment.domain.CreatedOrder;
import lombok.Builder;
import lombok.Value;

/**
 * REST API response after a gateway order is created. The storefront opens the hosted
 * checkout with {@code paymentSessionId} in the given {@code environment}.
 */
@Value
@Builder
public class CreateOrderResponseDto {

    String orderId;
    String cfOrderId;
    String paymentSessionId;
    String orderStatus;
    /** "sandbox" or "production", as the gateway's browser SDK expects. */
    String environment;
    String returnUrl;

    public static CreateOrderResponseDto from(CreatedOrder order) {
        return CreateOrderResponseDto.builder()
                .orderId(order.getOrderId())
                .cfOrderId(order.getCfOrderId())
                .paymentSessionId(order.getPaymentSessionId())
                .orderStatus(order.getOrderStatus())
                .environment(order.getEnvironment() != null && order.getEnvironment().isLive() ? "production" : "sandbox")
                .returnUrl(order.getReturnUrl())
                .build();
    }
}
