package com.storefront.payment.core.callback;

import com.storefront.payment.api.ConfigurationException;
import com.storefront.payment.config.PaymentProperties;
import com.storefront.payment.core.credentials.CredentialResolver;
import com.storefront.payment.core.urls.CallbackUrlResolver;
import com.storefront.payment.domain.FinalOutcome;
import com.storefront.payment.domain.RequestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReturnCallbackHandlerTest {

    private static final RequestContext CONTEXT = RequestContext.builder()
            .scheme("http").hostHeader("localhost:5001").build();

    @Mock
    private VerificationReconciler reconciler;

    @Mock
    private CredentialResolver credentialResolver;

    private ReturnCallbackHandler handler;

    @BeforeEach
    void setUp() {
        PaymentProperties properties = new PaymentProperties();
        handler = new ReturnCallbackHandler(new CallbackParameterExtractor(properties), reconciler,
                new CallbackUrlResolver(properties), credentialResolver);
        lenient().when(credentialResolver.resolve()).thenThrow(
                new ConfigurationException(ConfigurationException.Reason.CONFIG_MISSING, "not needed here"));
    }

    @Test
    void orderIdIsHandedToReconcilerWithStorefrontBase() {
        FinalOutcome verified = FinalOutcome.builder()
                .redirectTarget("http://localhost:3000/thankyou?order_id=order-1&payment_status=success&verified=true")
                .verified(true).success(true).orderId("order-1").build();
        when(reconciler.reconcile("order-1", "http://localhost:3000")).thenReturn(verified);

        FinalOutcome outcome = handler.handle(CallbackParameters.builder()
                .queryParam("order_id", "order-1")
                .queryParam("payment_status", "FAILED")
                .build(), CONTEXT);

        assertThat(outcome).isSameAs(verified);
    }

    @Test
    void successWithoutOrderIdIsUnverifiedSuccessPage() {
        FinalOutcome outcome = handler.handle(CallbackParameters.builder()
                .queryParam("payment_status", "SUCCESS")
                .build(), CONTEXT);

        assertThat(outcome.getRedirectTarget())
                .isEqualTo("http://localhost:3000/thankyou?payment_status=success&verified=false");
        assertThat(outcome.isVerified()).isFalse();
        verifyNoInteractions(reconciler);
    }

    @Test
    void nothingUsableRedirectsToCartWithMissingOrderId() {
        FinalOutcome outcome = handler.handle(CallbackParameters.builder()
                .queryParam("payment_status", "FAILED")
                .build(), CONTEXT);

        assertThat(outcome.getRedirectTarget()).isEqualTo("http://localhost:3000/cart?error=missing_order_id");
    }

    @Test
    void unexpectedErrorRedirectsToVerificationFailure() {
        when(reconciler.reconcile(anyString(), anyString())).thenThrow(new IllegalStateException("boom"));

        FinalOutcome outcome = handler.handle(CallbackParameters.builder()
                .bodyParam("orderId", "order-1")
                .build(), CONTEXT);

        assertThat(outcome.getRedirectTarget()).isEqualTo("http://localhost:3000/cart?error=payment_verification_failed");
        assertThat(outcome.isSuccess()).isFalse();
    }

    @Test
    void unsubstitutedReturnUrlTemplateIsMissingOrderId() {
        FinalOutcome outcome = handler.handle(CallbackParameters.builder()
                .queryParam("order_id", "{order_id}")
                .build(), CONTEXT);

        assertThat(outcome.getRedirectTarget()).isEqualTo("http://localhost:3000/cart?error=missing_order_id");
        verifyNoInteractions(reconciler);
    }

    @Test
    void storefrontUrlFailureStillRedirects() {
        doThrow(new IllegalStateException("settings store exploded")).when(credentialResolver).resolve();

        FinalOutcome outcome = handler.handle(CallbackParameters.builder()
                .queryParam("order_id", "order-1")
                .build(), CONTEXT);

        assertThat(outcome.getRedirectTarget()).isEqualTo("/cart?error=payment_verification_failed");
        assertThat(outcome.isSuccess()).isFalse();
        verifyNoInteractions(reconciler);
    }
}
