package com.storefront.payment.compliance;

import com.storefront.payment.domain.CreatedOrder;
import com.storefront.payment.domain.FinalOutcome;
import com.storefront.payment.domain.OrderPayload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes {@code [AUDIT]} lines for every order attempt, verification outcome and gateway
 * notification. Shopper contact details are masked.
 */
@Slf4j
@Component
public class PaymentAuditLogger {

    public void logOrderRequest(OrderPayload payload) {
        OrderPayload.Customer customer = payload.getCustomerDetails();
        log.info("[AUDIT] ORDER_REQUEST orderId={} amount={} currency={} customerId={} phone={} email={}",
                payload.getOrderId(),
                payload.getOrderAmount(),
                payload.getOrderCurrency(),
                customer == null ? null : customer.getCustomerId(),
                customer == null ? null : SensitiveDataMasker.maskPhone(customer.getCustomerPhone()),
                customer == null ? null : SensitiveDataMasker.maskEmail(customer.getCustomerEmail()));
    }

    public void logOrderCreated(CreatedOrder order) {
        log.info("[AUDIT] ORDER_CREATED orderId={} cfOrderId={} status={} environment={}",
                order.getOrderId(), order.getCfOrderId(), order.getOrderStatus(), order.getEnvironment());
    }

    public void logOrderFailed(String orderId, String failure) {
        log.info("[AUDIT] ORDER_FAILED orderId={} failure={}", orderId, failure);
    }

    public void logVerification(FinalOutcome outcome, String gatewayStatus) {
        log.info("[AUDIT] PAYMENT_VERIFICATION orderId={} gatewayStatus={} verified={} reason={}",
                outcome.getOrderId(), gatewayStatus, outcome.isVerified(), outcome.getReason());
    }

    public void logWebhook(String notificationId, String orderId, String eventType,
                           String reportedStatus, boolean signatureValid) {
        log.info("[AUDIT] WEBHOOK notificationId={} orderId={} type={} reportedStatus={} signatureValid={}",
                notificationId, orderId, eventType, reportedStatus, signatureValid);
    }
}
