package com.storefront.payment.domain;

/**
 * Why a gateway call never produced an HTTP response.
 */
public enum TransportErrorKind {
    /** Connect or read timeout. */
    TIMEOUT,
    /** DNS failure, refused connection or other I/O failure before a response. */
    UNREACHABLE
}
