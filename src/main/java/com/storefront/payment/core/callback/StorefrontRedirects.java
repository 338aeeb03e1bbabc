package com.storefront.payment.core.callback;

import org.springframework.web.util.UriComponentsBuilder;

/**
 * Storefront pages a shopper lands on after a payment return. Values are encoded after the
 * URI is built so braces in callback input are never read as URI template variables.
 */
final class StorefrontRedirects {

    static final String MISSING_ORDER_ID = "missing_order_id";
    static final String PAYMENT_FAILED = "payment_failed";
    static final String VERIFICATION_FAILED = "payment_verification_failed";

    private StorefrontRedirects() {}

    static String verifiedSuccess(String base, String orderId) {
        return UriComponentsBuilder.fromUriString(base)
                .path("/thankyou")
                .queryParam("order_id", orderId)
                .queryParam("payment_status", "success")
                .queryParam("verified", true)
                .build()
                .encode()
                .toUriString();
    }

    static String unverifiedSuccess(String base) {
        return UriComponentsBuilder.fromUriString(base)
                .path("/thankyou")
                .queryParam("payment_status", "success")
                .queryParam("verified", false)
                .build()
                .encode()
                .toUriString();
    }

    static String paymentFailed(String base, String orderId, String reason) {
        return UriComponentsBuilder.fromUriString(base)
                .path("/cart")
                .queryParam("error", PAYMENT_FAILED)
                .queryParam("order_id", orderId)
                .queryParam("reason", reason)
                .build()
                .encode()
                .toUriString();
    }

    static String cartError(String base, String error) {
        return UriComponentsBuilder.fromUriString(base)
                .path("/cart")
                .queryParam("error", error)
                .build()
                .encode()
                .toUriString();
    }
}
