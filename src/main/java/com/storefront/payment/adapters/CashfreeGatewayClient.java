package com.storefront.payment.adapters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.payment.api.ConfigurationException;
import com.storefront.payment.config.PaymentProperties;
import com.storefront.payment.core.PaymentGatewayClient;
import com.storefront.payment.domain.GatewayCredentials;
import com.storefront.payment.domain.GatewayOrderResult;
import com.storefront.payment.domain.OrderPayload;
import com.storefront.payment.domain.TransportErrorKind;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.UUID;

/**
 * Cashfree Payments order API client ({@code POST /orders}, {@code GET /orders/{id}}).
 *
 * <p>Credentials travel in the {@code x-client-id}/{@code x-client-secret} headers and are
 * never logged. Error responses are logged with their full body because the gateway's
 * {@code code}/{@code message} are the only diagnostic available for rejected orders.</p>
 */
@Slf4j
@Component
public class CashfreeGatewayClient implements PaymentGatewayClient {

    static final String HEADER_CLIENT_ID = "x-client-id";
    static final String HEADER_CLIENT_SECRET = "x-client-secret";
    static final String HEADER_API_VERSION = "x-api-version";
    static final String HEADER_REQUEST_ID = "x-request-id";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final PaymentProperties properties;

    public CashfreeGatewayClient(@Qualifier("gatewayRestTemplate") RestTemplate restTemplate,
                                 ObjectMapper objectMapper,
                                 PaymentProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public GatewayOrderResult createOrder(OrderPayload payload, GatewayCredentials credentials) {
        requireUsable(credentials);
        String body;
        try {
            body = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize order payload for orderId=" + payload.getOrderId(), e);
        }
        String url = baseUrl(credentials) + "/orders";
        log.info("Creating gateway order: orderId={} amount={} currency={} environment={}",
                payload.getOrderId(), payload.getOrderAmount(), payload.getOrderCurrency(), credentials.getEnvironment());
        return exchange("createOrder", url, HttpMethod.POST, new HttpEntity<>(body, headers(credentials)),
                payload.getOrderId());
    }

    @Override
    public GatewayOrderResult getOrderStatus(String orderId, GatewayCredentials credentials) {
        requireUsable(credentials);
        String url = baseUrl(credentials) + "/orders/{orderId}";
        log.info("Fetching gateway order status: orderId={} environment={}", orderId, credentials.getEnvironment());
        return exchange("getOrderStatus", url, HttpMethod.GET, new HttpEntity<>(headers(credentials)), orderId);
    }

    private GatewayOrderResult exchange(String operation, String url, HttpMethod method,
                                        HttpEntity<?> entity, String orderId) {
        long start = System.currentTimeMillis();
        try {
            ResponseEntity<String> response = method == HttpMethod.GET
                    ? restTemplate.exchange(url, method, entity, String.class, orderId)
                    : restTemplate.exchange(url, method, entity, String.class);
            int status = response.getStatusCode().value();
            JsonNode json = parseQuietly(response.getBody());
            if (json == null || !json.isObject()) {
                log.error("Gateway {} returned an unreadable body: orderId={} status={} body={}",
                        operation, orderId, status, response.getBody());
                return GatewayOrderResult.gatewayError("INVALID_RESPONSE",
                        "Gateway response is not a JSON object", status, null);
            }
            log.info("Gateway {} succeeded: orderId={} status={} latencyMs={}",
                    operation, orderId, status, System.currentTimeMillis() - start);
            return GatewayOrderResult.ok(json, status);
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            String responseBody = e.getResponseBodyAsString();
            JsonNode json = parseQuietly(responseBody);
            String code = text(json, "code");
            String message = text(json, "message");
            log.warn("Gateway {} rejected: orderId={} status={} code={} message={} body={}",
                    operation, orderId, status, code, message, responseBody);
            return GatewayOrderResult.gatewayError(
                    code != null ? code : "HTTP_" + status,
                    message != null ? message : e.getStatusText(),
                    status, json);
        } catch (ResourceAccessException e) {
            TransportErrorKind kind = isTimeout(e) ? TransportErrorKind.TIMEOUT : TransportErrorKind.UNREACHABLE;
            log.warn("Gateway {} transport failure: orderId={} kind={} latencyMs={} cause={}",
                    operation, orderId, kind, System.currentTimeMillis() - start, e.getMessage());
            return GatewayOrderResult.transportError(kind, e.getMessage());
        } catch (RestClientException e) {
            log.error("Gateway {} failed without a usable response: orderId={}", operation, orderId, e);
            return GatewayOrderResult.transportError(TransportErrorKind.UNREACHABLE, e.getMessage());
        }
    }

    private HttpHeaders headers(GatewayCredentials credentials) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        headers.set(HEADER_CLIENT_ID, credentials.getClientId());
        headers.set(HEADER_CLIENT_SECRET, credentials.getClientSecret());
        headers.set(HEADER_API_VERSION, properties.getGateway().getApiVersion());
        headers.set(HEADER_REQUEST_ID, requestId());
        return headers;
    }

    private String baseUrl(GatewayCredentials credentials) {
        String base = credentials.getEnvironment().isLive()
                ? properties.getGateway().getLiveBaseUrl()
                : properties.getGateway().getSandboxBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static void requireUsable(GatewayCredentials credentials) {
        if (credentials == null || !credentials.isUsable()) {
            throw new ConfigurationException(
                    credentials != null && !credentials.isEnabled()
                            ? ConfigurationException.Reason.DISABLED
                            : ConfigurationException.Reason.CONFIG_MISSING,
                    "Refusing to call payment gateway without usable credentials");
        }
    }

    /** Correlation id of the current request when there is one, so gateway logs line up with ours. */
    private static String requestId() {
        String correlationId = MDC.get("correlationId");
        return correlationId != null ? correlationId : UUID.randomUUID().toString();
    }

    private static boolean isTimeout(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private JsonNode parseQuietly(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Gateway error body is not JSON: {}", body);
            return null;
        }
    }

    private static String text(JsonNode json, String field) {
        if (json == null || json.get(field) == null || json.get(field).isNull()) {
            return null;
        }
        return json.get(field).asText();
    }
}
