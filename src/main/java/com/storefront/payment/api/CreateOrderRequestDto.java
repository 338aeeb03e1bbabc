package com.storefront.payment.api;

import com.storefront.payment.domain.CheckoutRequest;
import com.storefront.payment.domain.CustomerDetails;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Map;

/**
 * REST API request body for creating a gateway order at checkout. Only presence is checked
 * here; the order rules (amount range, phone format, id format) are applied when the order
 * payload is built, and all violations are reported together.
 */
@Data
public class CreateOrderRequestDto {

    @NotNull(message = "amount is required")
    private BigDecimal amount;

    /** INR when absent. */
    private String currency;

    @NotNull(message = "customer is required")
    @Valid
    private Customer customer;

    private String orderNote;

    /** Optional merchant order id; generated when absent. */
    private String orderId;

    private OffsetDateTime orderExpiryTime;

    private String paymentMethods;

    private Map<String, String> orderTags;

    @Data
    public static class Customer {
        private String customerId;
        private String phone;
        private String email;
        private String name;
    }

    public CheckoutRequest toCheckoutRequest() {
        return CheckoutRequest.builder()
                .amount(amount)
                .currency(currency)
                .customer(CustomerDetails.builder()
                        .customerId(customer.getCustomerId())
                        .phone(customer.getPhone())
                        .email(customer.getEmail())
                        .name(customer.getName())
                        .build())
                .orderNote(orderNote)
                .orderId(orderId)
                .orderExpiryTime(orderExpiryTime)
                .paymentMethods(paymentMethods)
                .orderTags(orderTags)
                .build();
    }
}
