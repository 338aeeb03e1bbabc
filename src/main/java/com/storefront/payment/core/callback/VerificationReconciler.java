package com.storefront.payment.core.callback;

import com.storefront.payment.api.ConfigurationException;
import com.storefront.payment.compliance.PaymentAuditLogger;
import com.storefront.payment.core.PaymentGatewayClient;
import com.storefront.payment.core.credentials.CredentialResolver;
import com.storefront.payment.domain.FinalOutcome;
import com.storefront.payment.domain.GatewayCredentials;
import com.storefront.payment.domain.GatewayOrderResult;
import com.storefront.payment.domain.GatewayOrderStatus;
import com.storefront.payment.messaging.PaymentLifecycleEventProducer;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Decides where a returning shopper goes by asking the gateway for the order's status.
 * Only a gateway-reported PAID leads to the success page; every other status or failure
 * leads to the cart with a reason.
 */
@Slf4j
@Service
public class VerificationReconciler {

    static final String REASON_GATEWAY_ERROR = "GATEWAY_ERROR";
    static final String REASON_CONFIGURATION_ERROR = "CONFIGURATION_ERROR";
    static final String REASON_UNKNOWN_STATUS = "UNKNOWN_STATUS";

    private final CredentialResolver credentialResolver;
    private final PaymentGatewayClient gatewayClient;
    private final Retry gatewayRetry;
    private final PaymentAuditLogger auditLogger;
    private final PaymentLifecycleEventProducer eventProducer;

    public VerificationReconciler(CredentialResolver credentialResolver,
                                  PaymentGatewayClient gatewayClient,
                                  @Qualifier("gatewayRetry") Retry gatewayRetry,
                                  PaymentAuditLogger auditLogger,
                                  PaymentLifecycleEventProducer eventProducer) {
        this.credentialResolver = credentialResolver;
        this.gatewayClient = gatewayClient;
        this.gatewayRetry = gatewayRetry;
        this.auditLogger = auditLogger;
        this.eventProducer = eventProducer;
    }

    public FinalOutcome reconcile(String orderId, String storefrontBaseUrl) {
        GatewayCredentials credentials;
        try {
            credentials = credentialResolver.resolve();
        } catch (ConfigurationException e) {
            log.error("Cannot verify orderId={}: gateway configuration unavailable ({})", orderId, e.getReason());
            return finish(failure(storefrontBaseUrl, orderId, REASON_CONFIGURATION_ERROR), null);
        }

        GatewayOrderResult result = gatewayRetry.executeSupplier(
                () -> gatewayClient.getOrderStatus(orderId, credentials));

        if (!result.isOk()) {
            String reason = result.getOutcome() == GatewayOrderResult.Outcome.TRANSPORT_ERROR
                    ? "TRANSPORT_" + result.getTransportErrorKind()
                    : REASON_GATEWAY_ERROR;
            log.warn("Order verification failed: orderId={} outcome={} errorCode={} httpStatus={}",
                    orderId, result.getOutcome(), result.getErrorCode(), result.getHttpStatus());
            return finish(failure(storefrontBaseUrl, orderId, reason), null);
        }

        String rawStatus = result.rawOrderStatus().orElse(null);
        boolean paid = result.orderStatus().filter(s -> s == GatewayOrderStatus.PAID).isPresent();
        log.info("Order verified with gateway: orderId={} orderStatus={} paid={}", orderId, rawStatus, paid);
        if (paid) {
            return finish(FinalOutcome.builder()
                    .redirectTarget(StorefrontRedirects.verifiedSuccess(storefrontBaseUrl, orderId))
                    .verified(true)
                    .success(true)
                    .orderId(orderId)
                    .build(), rawStatus);
        }
        return finish(failure(storefrontBaseUrl, orderId, rawStatus != null ? rawStatus : REASON_UNKNOWN_STATUS),
                rawStatus);
    }

    private static FinalOutcome failure(String base, String orderId, String reason) {
        return FinalOutcome.builder()
                .redirectTarget(StorefrontRedirects.paymentFailed(base, orderId, reason))
                .verified(false)
                .success(false)
                .orderId(orderId)
                .reason(reason)
                .build();
    }

    private FinalOutcome finish(FinalOutcome outcome, String gatewayStatus) {
        auditLogger.logVerification(outcome, gatewayStatus);
        eventProducer.publishReconciled(outcome, gatewayStatus);
        return outcome;
    }
}
