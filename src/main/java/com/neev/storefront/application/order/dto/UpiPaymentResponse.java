package com.neev.storefront.application.order.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

/**
 * UPI 결제 안내 (딥링크)
 */
public record UpiPaymentResponse(
        @Schema(description = "주문 ID", example = "1")
        Long orderId,
        @Schema(description = "결제 금액", example = "49998.00")
        BigDecimal amount,
        @Schema(description = "통화", example = "INR")
        String currency,
        @Schema(description = "UPI 딥링크", example = "upi://pay?pa=neev@upi&pn=NEEV&am=49998.00&cu=INR&tn=Order%201")
        String upiLink
) {}
