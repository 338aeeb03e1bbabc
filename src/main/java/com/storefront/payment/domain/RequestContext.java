package com.storefront.payment.domain;

import lombok.Builder;
import lombok.Value;

/**
 * The parts of an inbound HTTP request needed to work out externally reachable URLs.
 */
@Value
@Builder
public class RequestContext {

    /** Scheme the servlet container saw ("http" or "https"). */
    String scheme;

    /** Raw Host header, possibly with port. */
    String hostHeader;

    String serverName;

    int serverPort;

    /** Raw X-Forwarded-Proto header (may be a comma-separated list). */
    String forwardedProto;

    /** Raw X-Forwarded-Host header (may be a comma-separated list). */
    String forwardedHost;
}
