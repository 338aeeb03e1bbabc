package com.storefront.payment.core.callback;

import com.storefront.payment.config.PaymentProperties;
import com.storefront.payment.domain.CallbackOutcome;
import com.storefront.payment.domain.CallbackSource;
import com.storefront.payment.domain.ProvisionalStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Pulls the order id and the gateway's claimed payment status out of a browser return.
 *
 * <p>The gateway and its checkout SDKs have used many parameter spellings over time. Aliases
 * are tried in a fixed order, each first in the query string and then in the body; blank
 * values and unsubstituted {@code {...}} placeholders are skipped. The status is only a hint:
 * once an order id is known the gateway is asked for the real status.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallbackParameterExtractor {

    static final List<String> ORDER_ID_ALIASES = List.of(
            "order_id", "orderId", "ORDER_ID", "orderid",
            "merchant_order_id", "merchantOrderId",
            "cf_order_id", "cfOrderId", "CF_ORDER_ID",
            "reference_id", "referenceId",
            "order_token", "orderToken",
            "payment_session_id", "paymentSessionId");

    static final List<String> STATUS_ALIASES = List.of(
            "payment_status", "paymentStatus", "PAYMENT_STATUS",
            "txStatus", "tx_status", "txn_status",
            "order_status", "orderStatus",
            "payment_state", "status", "STATUS");

    private static final Set<String> SUCCESS_TOKENS = Set.of("SUCCESS", "PAID");
    private static final Set<String> FAILURE_TOKENS = Set.of(
            "FAILED", "FAILURE", "CANCELLED", "USER_DROPPED", "TERMINATED", "EXPIRED", "DECLINED");

    private static final List<Source> SOURCES = List.of(
            new Source(CallbackSource.QUERY, CallbackParameters::getQueryParams),
            new Source(CallbackSource.BODY, CallbackParameters::getBodyParams));

    private final PaymentProperties properties;

    public CallbackOutcome extract(CallbackParameters parameters) {
        Optional<Match> orderId = find(parameters, ORDER_ID_ALIASES);
        Optional<Match> status = find(parameters, STATUS_ALIASES);

        ProvisionalStatus provisional = status.map(m -> classify(m.value)).orElse(ProvisionalStatus.UNKNOWN);
        CallbackSource source = orderId.map(m -> m.source).orElse(status.map(m -> m.source).orElse(null));

        if (status.isEmpty() && parameters.isEmpty() && refererIndicatesSuccess(parameters.getReferer())) {
            provisional = ProvisionalStatus.SUCCESS;
            source = CallbackSource.REFERER;
        }

        return CallbackOutcome.builder()
                .extractedOrderId(orderId.map(m -> m.value).orElse(null))
                .orderIdAlias(orderId.map(m -> m.alias).orElse(null))
                .provisionalStatus(provisional)
                .source(source)
                .build();
    }

    static ProvisionalStatus classify(String token) {
        String normalized = token.trim().toUpperCase(Locale.ROOT);
        if (SUCCESS_TOKENS.contains(normalized)) {
            return ProvisionalStatus.SUCCESS;
        }
        if (FAILURE_TOKENS.contains(normalized)) {
            return ProvisionalStatus.FAILURE;
        }
        return ProvisionalStatus.UNKNOWN;
    }

    private static Optional<Match> find(CallbackParameters parameters, List<String> aliases) {
        for (String alias : aliases) {
            for (Source source : SOURCES) {
                Map<String, String> values = source.values.apply(parameters);
                String value = values == null ? null : values.get(alias);
                if (value == null || value.isBlank()) {
                    continue;
                }
                if (isUnsubstitutedPlaceholder(value)) {
                    log.warn("Ignoring unsubstituted placeholder for {}: {}", alias, value);
                    continue;
                }
                return Optional.of(new Match(alias, value.trim(), source.kind));
            }
        }
        return Optional.empty();
    }

    /** Template such as {@code {order_id}} that the gateway sent back without filling in. */
    static boolean isUnsubstitutedPlaceholder(String value) {
        String trimmed = value.trim();
        return trimmed.startsWith("{") && trimmed.endsWith("}");
    }

    private boolean refererIndicatesSuccess(String referer) {
        if (referer == null || referer.isBlank()) {
            return false;
        }
        String host;
        try {
            host = URI.create(referer.trim()).getHost();
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring malformed Referer on payment return: {}", referer);
            return false;
        }
        if (host == null) {
            return false;
        }
        String lowerHost = host.toLowerCase(Locale.ROOT);
        boolean gatewayHost = properties.getGateway().getRefererHosts().stream()
                .map(h -> h.toLowerCase(Locale.ROOT))
                .anyMatch(h -> lowerHost.equals(h) || lowerHost.endsWith("." + h));
        String lowerReferer = referer.toLowerCase(Locale.ROOT);
        return gatewayHost && (lowerReferer.contains("success") || lowerReferer.contains("paid"));
    }

    private static final class Source {
        private final CallbackSource kind;
        private final Function<CallbackParameters, Map<String, String>> values;

        private Source(CallbackSource kind, Function<CallbackParameters, Map<String, String>> values) {
            this.kind = kind;
            this.values = values;
        }
    }

    private static final class Match {
        private final String alias;
        private final String value;
        private final CallbackSource source;

        private Match(String alias, String value, CallbackSource source) {
            this.alias = alias;
            this.value = value;
            this.source = source;
        }
    }
}
