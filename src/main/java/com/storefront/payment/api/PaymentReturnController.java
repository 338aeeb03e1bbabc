package com.storefront.payment.api;

import com.storefront.payment.core.callback.CallbackParameters;
import com.storefront.payment.core.callback.ReturnCallbackHandler;
import com.storefront.payment.domain.FinalOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Landing endpoint for the shopper's browser after the hosted checkout. Always answers with
 * a 302 to a storefront page.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments/return")
@RequiredArgsConstructor
@Tag(name = "Payment return", description = "Gateway browser return, redirected to the storefront")
public class PaymentReturnController {

    /** Host-relative target used when no usable redirect could be produced. */
    static final String FALLBACK_LOCATION = "/cart?error=payment_verification_failed";

    private final ReturnCallbackHandler handler;

    @GetMapping
    @Operation(summary = "Payment return (GET)", description = "Verifies the order with the gateway and redirects to /thankyou or /cart.")
    public ResponseEntity<Void> returnGet(HttpServletRequest request) {
        return redirect(request, Map.of());
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Payment return (POST, JSON body)")
    public ResponseEntity<Void> returnPostJson(@RequestBody(required = false) Map<String, Object> body,
                                               HttpServletRequest request) {
        Map<String, String> values = new LinkedHashMap<>();
        if (body != null) {
            body.forEach((key, value) -> {
                if (value != null && !(value instanceof Map) && !(value instanceof List)) {
                    values.put(key, String.valueOf(value));
                }
            });
        }
        return redirect(request, values);
    }

    @PostMapping
    @Operation(summary = "Payment return (POST, form body)")
    public ResponseEntity<Void> returnPostForm(HttpServletRequest request) {
        Map<String, String> query = queryParams(request);
        Map<String, String> form = new LinkedHashMap<>();
        request.getParameterMap().forEach((key, values) -> {
            if (values.length > 0 && !query.containsKey(key)) {
                form.put(key, values[0]);
            }
        });
        return redirect(request, form);
    }

    private ResponseEntity<Void> redirect(HttpServletRequest request, Map<String, String> body) {
        URI location;
        try {
            CallbackParameters parameters = CallbackParameters.builder()
                    .queryParams(queryParams(request))
                    .bodyParams(body)
                    .referer(request.getHeader(HttpHeaders.REFERER))
                    .build();
            FinalOutcome outcome = handler.handle(parameters, RequestContexts.from(request));
            log.info("Redirecting payment return: orderId={} verified={} target={}",
                    outcome.getOrderId(), outcome.isVerified(), outcome.getRedirectTarget());
            location = URI.create(outcome.getRedirectTarget());
        } catch (Exception e) {
            log.error("Payment return produced no usable redirect; sending shopper to {}", FALLBACK_LOCATION, e);
            location = URI.create(FALLBACK_LOCATION);
        }
        return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
    }

    /** Query-string parameters only (first value per name), decoded. */
    private static Map<String, String> queryParams(HttpServletRequest request) {
        Map<String, String> result = new LinkedHashMap<>();
        String queryString = request.getQueryString();
        if (queryString == null || queryString.isBlank()) {
            return result;
        }
        MultiValueMap<String, String> raw = UriComponentsBuilder.newInstance().query(queryString).build().getQueryParams();
        raw.forEach((key, values) -> {
            String value = values.isEmpty() || values.get(0) == null ? "" : values.get(0);
            result.put(decode(key), decode(value));
        });
        return result;
    }

    private static String decode(String value) {
        try {
            return URLDecoder.decode(value, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return value;
        }
    }
}
