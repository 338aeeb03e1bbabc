package com.storefront.payment.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Body of the gateway's order-creation call. Field names serialize in the gateway's
 * snake_case form; null fields are omitted.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class OrderPayload {

    String orderId;
    BigDecimal orderAmount;
    String orderCurrency;
    Customer customerDetails;
    String orderNote;
    /** ISO-8601 instant with offset. */
    String orderExpiryTime;
    Meta orderMeta;
    Map<String, String> orderTags;

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Customer {
        String customerId;
        String customerPhone;
        String customerEmail;
        String customerName;
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class Meta {
        String returnUrl;
        String notifyUrl;
        String paymentMethods;
    }
}
