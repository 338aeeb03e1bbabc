package com.storefront.payment.api;

import com.storefront.payment.core.credentials.CredentialResolver;
import com.storefront.payment.core.order.CheckoutOrderService;
import com.storefront.payment.domain.CreatedOrder;
import com.storefront.payment.domain.OrderStatusView;
import com.storefront.payment.domain.PaymentConfigView;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for checkout: gateway order creation, status lookup and gateway configuration.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Create and query hosted-checkout gateway orders")
public class PaymentController {

    private final CheckoutOrderService checkoutOrderService;
    private final CredentialResolver credentialResolver;

    @PostMapping("/orders")
    @Operation(
            summary = "Create gateway order",
            description = "Validates the checkout input, registers callback URLs for this deployment and creates the "
                    + "order with the gateway. Returns the payment session id the storefront opens the hosted checkout with. "
                    + "The order id is generated when not supplied.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Order created.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = CreateOrderResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed. Body: { \"error\": \"VALIDATION_FAILED\", \"details\": [...] }"),
            @ApiResponse(responseCode = "429", description = "Gateway rate limit. Body: { \"error\": \"RATE_LIMITED\", \"message\": \"...\" }"),
            @ApiResponse(responseCode = "502", description = "Gateway rejected the order. Body: { \"error\": \"GATEWAY_ERROR\", \"message\": \"...\" }"),
            @ApiResponse(responseCode = "503", description = "Payments disabled or not configured, or gateway unreachable. Body: { \"error\": \"PAYMENTS_UNAVAILABLE\"|\"GATEWAY_UNREACHABLE\", ... }"),
            @ApiResponse(responseCode = "504", description = "Gateway timed out. Body: { \"error\": \"GATEWAY_TIMEOUT\", \"message\": \"...\" }")
    })
    public ResponseEntity<CreateOrderResponseDto> createOrder(@Valid @RequestBody CreateOrderRequestDto dto,
                                                              HttpServletRequest httpRequest) {
        CreatedOrder order = checkoutOrderService.createOrder(dto.toCheckoutRequest(), RequestContexts.from(httpRequest));
        log.info("Checkout order created: orderId={} cfOrderId={} environment={}",
                order.getOrderId(), order.getCfOrderId(), order.getEnvironment());
        return ResponseEntity.ok(CreateOrderResponseDto.from(order));
    }

    @GetMapping("/orders/{orderId}/status")
    @Operation(summary = "Get order status", description = "Authoritative order status, fetched from the gateway.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Current gateway status.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = OrderStatusView.class))),
            @ApiResponse(responseCode = "404", description = "Gateway does not know the order. Body: { \"error\": \"ORDER_NOT_FOUND\", ... }")
    })
    public ResponseEntity<OrderStatusView> getStatus(@PathVariable String orderId) {
        return ResponseEntity.ok(checkoutOrderService.verify(orderId));
    }

    @GetMapping("/config")
    @Operation(summary = "Gateway configuration", description = "Whether payments are enabled and in which environment. Never returns credentials.")
    public ResponseEntity<PaymentConfigView> getConfig() {
        return ResponseEntity.ok(checkoutOrderService.describeConfiguration());
    }

    @PostMapping("/config/refresh")
    @Operation(summary = "Reload gateway credentials",
            description = "Drops cached credentials so the next request reads the settings store and environment again. "
                    + "Call after rotating or disabling credentials.")
    public ResponseEntity<Map<String, Object>> refreshConfig() {
        credentialResolver.invalidate();
        log.info("Gateway credential refresh requested");
        return ResponseEntity.ok(Map.of("refreshed", true));
    }
}
