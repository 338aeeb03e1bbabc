package com.storefront.payment.core.order;

import com.storefront.payment.api.OrderValidationException;
import com.storefront.payment.api.OrderValidationException.FieldViolation;
import com.storefront.payment.config.PaymentProperties;
import com.storefront.payment.domain.CallbackUrls;
import com.storefront.payment.domain.CheckoutRequest;
import com.storefront.payment.domain.CustomerDetails;
import com.storefront.payment.domain.GatewayCredentials;
import com.storefront.payment.domain.OrderCurrency;
import com.storefront.payment.domain.OrderPayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Validates checkout input and turns it into the gateway's order-creation body.
 *
 * <p>All rules are checked before failing, so the caller sees every violation at once. The
 * builder does no I/O; time and randomness come from the injected clock and
 * {@link OrderIdGenerator}. With a caller-supplied order id the output is fully determined by
 * the input apart from the default expiry.</p>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OrderPayloadBuilder {

    private static final Pattern PHONE = Pattern.compile("^[6-9]\\d{9}$");
    private static final Pattern EMAIL = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern ORDER_ID = Pattern.compile("^[A-Za-z0-9_-]{3,45}$");
    private static final int NAME_MIN = 2;
    private static final int NAME_MAX = 100;

    private final PaymentProperties properties;
    private final OrderIdGenerator orderIdGenerator;
    private final Clock clock;

    /**
     * @throws OrderValidationException listing every violated rule; nothing is built
     */
    public OrderPayload build(CheckoutRequest request, GatewayCredentials credentials, CallbackUrls callbackUrls) {
        PaymentProperties.Order rules = properties.getOrder();
        Instant now = clock.instant();
        List<FieldViolation> violations = new ArrayList<>();

        BigDecimal amount = request.getAmount();
        if (amount == null) {
            violations.add(new FieldViolation("amount", "amount is required"));
        } else if (amount.compareTo(rules.getMinAmount()) < 0) {
            violations.add(new FieldViolation("amount", "amount must be at least " + rules.getMinAmount()));
        } else if (amount.compareTo(rules.getMaxAmount()) > 0) {
            violations.add(new FieldViolation("amount", "amount must not exceed " + rules.getMaxAmount()));
        }

        String currency = trimToNull(request.getCurrency());
        if (currency == null) {
            currency = OrderCurrency.INR.name();
        } else if (OrderCurrency.fromCode(currency).isEmpty()) {
            violations.add(new FieldViolation("currency", "currency must be one of INR, USD, EUR"));
        }

        CustomerDetails customer = request.getCustomer();
        String phone = customer == null ? null : trimToNull(customer.getPhone());
        String email = customer == null ? null : trimToNull(customer.getEmail());
        String name = customer == null ? null : trimToNull(customer.getName());
        if (phone == null) {
            violations.add(new FieldViolation("customer.phone", "customer phone is required"));
        } else if (!PHONE.matcher(phone).matches()) {
            violations.add(new FieldViolation("customer.phone",
                    "customer phone must be a 10-digit mobile number starting with 6-9"));
        }
        if (email != null && !EMAIL.matcher(email).matches()) {
            violations.add(new FieldViolation("customer.email", "customer email is not a valid address"));
        }
        if (name != null && (name.length() < NAME_MIN || name.length() > NAME_MAX)) {
            violations.add(new FieldViolation("customer.name",
                    "customer name must be " + NAME_MIN + "-" + NAME_MAX + " characters"));
        }

        String suppliedOrderId = trimToNull(request.getOrderId());
        if (suppliedOrderId != null && !ORDER_ID.matcher(suppliedOrderId).matches()) {
            violations.add(new FieldViolation("orderId",
                    "order id must be 3-45 characters of letters, digits, '_' or '-'"));
        }

        OffsetDateTime requestedExpiry = request.getOrderExpiryTime();
        if (requestedExpiry != null && !requestedExpiry.toInstant().isAfter(now)) {
            violations.add(new FieldViolation("orderExpiryTime", "order expiry time must be in the future"));
        }

        if (!violations.isEmpty()) {
            log.info("Checkout input rejected: {} violation(s) {}", violations.size(), violations);
            throw new OrderValidationException(violations);
        }

        long buildMillis = now.toEpochMilli();
        String orderId = suppliedOrderId != null ? suppliedOrderId : orderIdGenerator.nextId(buildMillis);
        String customerIdSuffix = suppliedOrderId != null
                ? sha1Hex(suppliedOrderId).substring(0, 8)
                : String.valueOf(buildMillis);
        String customerId = trimToNull(customer.getCustomerId());
        if (customerId == null) {
            String identity = phone != null ? phone : email;
            customerId = "CUST_" + sha1Hex(rules.getCustomerIdSalt() + identity).substring(0, 8) + "_" + customerIdSuffix;
        }

        String expiry = requestedExpiry != null
                ? requestedExpiry.truncatedTo(ChronoUnit.SECONDS).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME)
                : OffsetDateTime.ofInstant(now.plus(rules.getExpiry()), ZoneOffset.UTC)
                        .truncatedTo(ChronoUnit.SECONDS)
                        .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);

        String paymentMethods = trimToNull(request.getPaymentMethods());
        String note = trimToNull(request.getOrderNote());

        OrderPayload payload = OrderPayload.builder()
                .orderId(orderId)
                .orderAmount(amount.setScale(2, RoundingMode.HALF_UP))
                .orderCurrency(currency)
                .customerDetails(OrderPayload.Customer.builder()
                        .customerId(customerId)
                        .customerPhone(phone)
                        .customerEmail(email)
                        .customerName(name)
                        .build())
                .orderNote(note != null ? note : rules.getDefaultNote())
                .orderExpiryTime(expiry)
                .orderMeta(OrderPayload.Meta.builder()
                        .returnUrl(callbackUrls.getReturnUrl())
                        .notifyUrl(callbackUrls.getNotifyUrl())
                        .paymentMethods(paymentMethods != null ? paymentMethods : rules.getPaymentMethods())
                        .build())
                .orderTags(request.getOrderTags() == null || request.getOrderTags().isEmpty()
                        ? null : new LinkedHashMap<>(request.getOrderTags()))
                .build();

        log.debug("Built order payload: orderId={} amount={} currency={} environment={}",
                orderId, payload.getOrderAmount(), currency,
                credentials == null ? null : credentials.getEnvironment());
        return payload;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String sha1Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
