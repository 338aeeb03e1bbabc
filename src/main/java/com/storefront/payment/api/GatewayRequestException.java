package com.storefront.payment.api;

import com.storefront.payment.domain.GatewayOrderResult;

/**
 * A gateway call did not succeed. The carried result tells a gateway-returned error apart
 * from a transport failure; the handler maps them to 502/429 and 504/503 respectively.
 */
public class GatewayRequestException extends RuntimeException {

    private final GatewayOrderResult result;

    public GatewayRequestException(String operation, GatewayOrderResult result) {
        super(operation + " failed: " + describe(result));
        this.result = result;
    }

    public GatewayOrderResult getResult() {
        return result;
    }

    private static String describe(GatewayOrderResult result) {
        if (result.getOutcome() == GatewayOrderResult.Outcome.TRANSPORT_ERROR) {
            return "transport " + result.getTransportErrorKind() + " (" + result.getMessage() + ")";
        }
        return "gateway " + result.getHttpStatus() + " " + result.getErrorCode() + " (" + result.getMessage() + ")";
    }
}
