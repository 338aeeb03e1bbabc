package com.storefront.payment.api;

import com.storefront.payment.core.callback.CallbackParameters;
import com.storefront.payment.core.callback.ReturnCallbackHandler;
import com.storefront.payment.domain.FinalOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = PaymentReturnController.class)
class PaymentReturnControllerTest {

    private static final String THANK_YOU =
            "http://localhost:3000/thankyou?order_id=order-1&payment_status=success&verified=true";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ReturnCallbackHandler handler;

    @BeforeEach
    void setUp() {
        when(handler.handle(any(), any())).thenReturn(FinalOutcome.builder()
                .redirectTarget(THANK_YOU).verified(true).success(true).orderId("order-1").build());
    }

    @Test
    void getReturnRedirectsWithQueryParameters() throws Exception {
        mockMvc.perform(get("/api/v1/payments/return?order_id=order-1&payment_status=SUCCESS")
                        .header(HttpHeaders.REFERER, "https://payments.cashfree.com/checkout"))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.LOCATION, THANK_YOU));

        CallbackParameters parameters = captured();
        assertThat(parameters.getQueryParams())
                .containsEntry("order_id", "order-1")
                .containsEntry("payment_status", "SUCCESS");
        assertThat(parameters.getBodyParams()).isEmpty();
        assertThat(parameters.getReferer()).isEqualTo("https://payments.cashfree.com/checkout");
    }

    @Test
    void formPostSeparatesBodyFromQuery() throws Exception {
        mockMvc.perform(post("/api/v1/payments/return?order_id=order-1")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("txStatus", "SUCCESS"))
                .andExpect(status().isFound());

        CallbackParameters parameters = captured();
        assertThat(parameters.getQueryParams()).containsOnlyKeys("order_id");
        assertThat(parameters.getBodyParams()).containsEntry("txStatus", "SUCCESS").doesNotContainKey("order_id");
    }

    @Test
    void jsonPostKeepsScalarFields() throws Exception {
        mockMvc.perform(post("/api/v1/payments/return")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"orderId\":\"order-1\",\"cf_order_id\":2149460581,\"meta\":{\"a\":1}}"))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.LOCATION, THANK_YOU));

        CallbackParameters parameters = captured();
        assertThat(parameters.getBodyParams())
                .containsEntry("orderId", "order-1")
                .containsEntry("cf_order_id", "2149460581")
                .doesNotContainKey("meta");
    }

    @Test
    void unusableRedirectTargetFallsBackToCartFailure() throws Exception {
        when(handler.handle(any(), any())).thenReturn(FinalOutcome.builder()
                .redirectTarget("http://localhost:3000/cart?order_id={order_id}").build());

        mockMvc.perform(get("/api/v1/payments/return?order_id=%7Border_id%7D"))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.LOCATION, "/cart?error=payment_verification_failed"));
    }

    @Test
    void handlerFailureFallsBackToCartFailure() throws Exception {
        when(handler.handle(any(), any())).thenThrow(new IllegalStateException("boom"));

        mockMvc.perform(post("/api/v1/payments/return")
                        .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                        .param("orderId", "order-1"))
                .andExpect(status().isFound())
                .andExpect(header().string(HttpHeaders.LOCATION, "/cart?error=payment_verification_failed"));
    }

    private CallbackParameters captured() {
        ArgumentCaptor<CallbackParameters> captor = ArgumentCaptor.forClass(CallbackParameters.class);
        verify(handler).handle(captor.capture(), any());
        return captor.getValue();
    }
}
