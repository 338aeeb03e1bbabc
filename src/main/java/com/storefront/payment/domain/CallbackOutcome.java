package com.storefront.payment.domain;

import lombok.Builder;
import lombok.Value;

/**
 * What could be read from one gateway return callback.
 */
@Value
@Builder
public class CallbackOutcome {

    String extractedOrderId;

    /** Parameter name the order id was found under, for logs. */
    String orderIdAlias;

    ProvisionalStatus provisionalStatus;

    /** Source of the order id, or of the status when no order id was found. */
    CallbackSource source;

    public boolean hasOrderId() {
        return extractedOrderId != null && !extractedOrderId.isBlank();
    }

    /** Shopper finished checkout per the gateway, but there is nothing to verify against. */
    public boolean isUnverifiedSuccess() {
        return !hasOrderId() && provisionalStatus == ProvisionalStatus.SUCCESS;
    }
}
