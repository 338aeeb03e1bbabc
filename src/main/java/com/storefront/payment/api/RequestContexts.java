package com.storefront.payment.api;

import com.storefront.payment.domain.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;

/**
 * Builds {@link RequestContext} from servlet requests.
 */
final class RequestContexts {

    private RequestContexts() {}

    static RequestContext from(HttpServletRequest request) {
        return RequestContext.builder()
                .scheme(request.getScheme())
                .hostHeader(request.getHeader(HttpHeaders.HOST))
                .serverName(request.getServerName())
                .serverPort(request.getServerPort())
                .forwardedProto(request.getHeader("X-Forwarded-Proto"))
                .forwardedHost(request.getHeader("X-Forwarded-Host"))
                .build();
    }
}
