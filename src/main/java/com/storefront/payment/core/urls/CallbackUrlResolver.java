package com.storefront.payment.core.urls;

import com.storefront.payment.config.PaymentProperties;
import com.storefront.payment.domain.CallbackUrls;
import com.storefront.payment.domain.GatewayEnvironment;
import com.storefront.payment.domain.RequestContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Set;

/**
 * Works out the externally reachable storefront and backend base URLs for a request, and the
 * callback URLs registered with a gateway order.
 *
 * <p>Explicit overrides ({@code payment.urls.client-base-url}, {@code server-base-url}) win;
 * otherwise the URL is derived from forwarding headers, then the Host header, then the
 * servlet's server name and port. On loopback hosts the storefront and backend run on
 * different ports, so the port is swapped. LIVE always yields https.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallbackUrlResolver {

    private static final String AUTO = "auto";
    private static final Set<String> LOOPBACK_HOSTS = Set.of("localhost", "127.0.0.1", "[::1]");

    private final PaymentProperties properties;

    /** Storefront base URL, without trailing slash. */
    public String resolveClientUrl(RequestContext context, GatewayEnvironment environment) {
        PaymentProperties.Urls urls = properties.getUrls();
        return resolve(urls.getClientBaseUrl(), context, environment, urls.getBackendPort(), urls.getFrontendPort());
    }

    /** Backend base URL, without trailing slash. */
    public String resolveServerUrl(RequestContext context, GatewayEnvironment environment) {
        PaymentProperties.Urls urls = properties.getUrls();
        return resolve(urls.getServerBaseUrl(), context, environment, urls.getFrontendPort(), urls.getBackendPort());
    }

    public CallbackUrls callbackUrls(RequestContext context, GatewayEnvironment environment) {
        String server = resolveServerUrl(context, environment);
        CallbackUrls callbackUrls = new CallbackUrls(
                server + properties.getUrls().getReturnPath(),
                server + properties.getUrls().getNotifyPath());
        log.debug("Callback URLs for environment={}: returnUrl={} notifyUrl={}",
                environment, callbackUrls.getReturnUrl(), callbackUrls.getNotifyUrl());
        return callbackUrls;
    }

    private String resolve(String override, RequestContext context, GatewayEnvironment environment,
                           int loopbackFromPort, int loopbackToPort) {
        if (override != null && !override.isBlank() && !AUTO.equalsIgnoreCase(override.trim())) {
            return finish(override.trim(), environment);
        }

        String scheme = firstValue(context.getForwardedProto());
        if (scheme == null) {
            scheme = context.getScheme() == null || context.getScheme().isBlank() ? "http" : context.getScheme();
        }

        String host = firstValue(context.getForwardedHost());
        if (host == null) {
            host = context.getHostHeader() == null || context.getHostHeader().isBlank()
                    ? serverHost(context)
                    : context.getHostHeader().trim();
        }

        HostPort hostPort = HostPort.parse(host);
        if (LOOPBACK_HOSTS.contains(hostPort.host.toLowerCase(Locale.ROOT)) && hostPort.port == loopbackFromPort) {
            hostPort = new HostPort(hostPort.host, loopbackToPort);
        }

        return finish(scheme.toLowerCase(Locale.ROOT) + "://" + hostPort, environment);
    }

    private static String finish(String url, GatewayEnvironment environment) {
        String result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        if (environment != null && environment.isLive() && result.startsWith("http://")) {
            result = "https://" + result.substring("http://".length());
        }
        return result;
    }

    private static String serverHost(RequestContext context) {
        String name = context.getServerName() == null || context.getServerName().isBlank()
                ? "localhost" : context.getServerName();
        return context.getServerPort() > 0 ? name + ":" + context.getServerPort() : name;
    }

    /** First entry of a comma-separated forwarding header, or null. */
    private static String firstValue(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String first = header.split(",")[0].trim();
        return first.isEmpty() ? null : first;
    }

    private static final class HostPort {
        private final String host;
        /** -1 when the authority carries no port. */
        private final int port;

        private HostPort(String host, int port) {
            this.host = host;
            this.port = port;
        }

        static HostPort parse(String authority) {
            int portSeparator = authority.lastIndexOf(':');
            int ipv6End = authority.lastIndexOf(']');
            if (portSeparator <= ipv6End) {
                return new HostPort(authority, -1);
            }
            try {
                int port = Integer.parseInt(authority.substring(portSeparator + 1));
                return new HostPort(authority.substring(0, portSeparator), port);
            } catch (NumberFormatException e) {
                return new HostPort(authority, -1);
            }
        }

        @Override
        public String toString() {
            return port < 0 ? host : host + ":" + port;
        }
    }
}
