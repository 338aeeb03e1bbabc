package com.storefront.payment.core.callback;

import com.storefront.payment.api.ConfigurationException;
import com.storefront.payment.core.credentials.CredentialResolver;
import com.storefront.payment.core.urls.CallbackUrlResolver;
import com.storefront.payment.domain.CallbackOutcome;
import com.storefront.payment.domain.FinalOutcome;
import com.storefront.payment.domain.GatewayEnvironment;
import com.storefront.payment.domain.RequestContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Handles the shopper's browser returning from the hosted checkout page, for GET and POST
 * alike, and always produces a storefront redirect. Nothing here throws to the browser.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReturnCallbackHandler {

    /** Storefront base when it cannot be resolved: the redirect becomes host-relative. */
    static final String FALLBACK_BASE = "";

    private final CallbackParameterExtractor extractor;
    private final VerificationReconciler reconciler;
    private final CallbackUrlResolver urlResolver;
    private final CredentialResolver credentialResolver;

    public FinalOutcome handle(CallbackParameters parameters, RequestContext context) {
        String clientBase = null;
        try {
            log.info("Payment return received: query={} body={} referer={}",
                    parameters.getQueryParams(), parameters.getBodyParams(), parameters.getReferer());
            clientBase = clientBaseUrl(context);

            CallbackOutcome outcome = extractor.extract(parameters);
            log.info("Payment return parsed: orderId={} alias={} provisionalStatus={} source={}",
                    outcome.getExtractedOrderId(), outcome.getOrderIdAlias(),
                    outcome.getProvisionalStatus(), outcome.getSource());

            if (outcome.hasOrderId()) {
                return reconciler.reconcile(outcome.getExtractedOrderId(), clientBase);
            }
            if (outcome.isUnverifiedSuccess()) {
                log.warn("Payment return claims success without an order id; redirecting unverified");
                return FinalOutcome.builder()
                        .redirectTarget(StorefrontRedirects.unverifiedSuccess(clientBase))
                        .verified(false)
                        .success(true)
                        .build();
            }
            log.warn("Payment return without an order id: provisionalStatus={}", outcome.getProvisionalStatus());
            return cartError(clientBase, StorefrontRedirects.MISSING_ORDER_ID);
        } catch (Exception e) {
            log.error("Payment return handling failed", e);
            return cartError(clientBase != null ? clientBase : FALLBACK_BASE,
                    StorefrontRedirects.VERIFICATION_FAILED);
        }
    }

    private static FinalOutcome cartError(String clientBase, String error) {
        return FinalOutcome.builder()
                .redirectTarget(StorefrontRedirects.cartError(clientBase, error))
                .verified(false)
                .success(false)
                .reason(error)
                .build();
    }

    /** The storefront URL does not depend on working credentials; LIVE only upgrades the scheme. */
    private String clientBaseUrl(RequestContext context) {
        GatewayEnvironment environment = null;
        try {
            environment = credentialResolver.resolve().getEnvironment();
        } catch (ConfigurationException e) {
            log.debug("Resolving storefront URL without gateway environment: {}", e.getReason());
        }
        return urlResolver.resolveClientUrl(context, environment);
    }
}
