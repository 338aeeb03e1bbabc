package com.storefront.payment.core.callback;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Raw inputs of one gateway browser return: query string, form or JSON body, and Referer.
 */
@Value
@Builder
public class CallbackParameters {

    @Singular
    Map<String, String> queryParams;

    @Singular
    Map<String, String> bodyParams;

    String referer;

    public boolean isEmpty() {
        return queryParams.isEmpty() && bodyParams.isEmpty();
    }
}
