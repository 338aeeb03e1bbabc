package com.storefront.payment.domain;

/**
 * Payment outcome as claimed by the return callback's own parameters. Never trusted for
 * fund-bearing decisions once an order id is known.
 */
public enum ProvisionalStatus {
    SUCCESS,
    FAILURE,
    UNKNOWN
}
