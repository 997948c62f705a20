package com.neev.storefront.application.order.dto;

import com.neev.storefront.domain.order.OrderStatus;
import com.neev.storefront.domain.order.entity.Order;
import com.neev.storefront.domain.payment.PaymentMethod;
import com.neev.storefront.domain.payment.PaymentStatus;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 관리자 주문 목록 항목
 */
public record OrderSummaryResponse(
        @Schema(description = "주문 ID", example = "1")
        Long orderId,
        @Schema(description = "게이트웨이 주문 ID")
        String externalId,
        @Schema(description = "주문자 이름", example = "Asha Rao")
        String customerName,
        @Schema(description = "연락처", example = "9876543210")
        String customerPhone,
        @Schema(description = "총 금액", example = "49998.00")
        BigDecimal totalAmount,
        @Schema(description = "결제 수단", example = "UPI")
        PaymentMethod paymentMethod,
        @Schema(description = "결제 상태", example = "PENDING")
        PaymentStatus paymentStatus,
        @Schema(description = "주문 상태", example = "CREATED")
        OrderStatus status,
        @Schema(description = "주문 일시")
        LocalDateTime createdAt
) {
    public static OrderSummaryResponse from(Order order) {
        return new OrderSummaryResponse(
                order.getId(),
                order.getExternalId(),
                order.getCustomer().name(),
                order.getCustomer().phone(),
                order.getTotalAmount(),
                order.getPaymentMethod(),
                order.getPaymentStatus(),
                order.getStatus(),
                order.getCreatedAt()
        );
    }
}
