package com.neev.storefront.application.order.dto;

import com.neev.storefront.domain.order.entity.OrderItem;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

public record OrderItemResponse(
        @Schema(description = "상품 ID (삭제된 상품이면 null 일 수 있음)", example = "1")
        Long productId,
        @Schema(description = "주문 당시 상품명", example = "Round Brilliant 1.0 ct")
        String productName,
        @Schema(description = "주문 당시 단가", example = "24999.00")
        BigDecimal unitPrice,
        @Schema(description = "수량", example = "2")
        int quantity,
        @Schema(description = "소계", example = "49998.00")
        BigDecimal subtotal
) {
    public static OrderItemResponse from(OrderItem item) {
        return new OrderItemResponse(
                item.getProductId(),
                item.getProductName(),
                item.getUnitPrice(),
                item.getQuantity(),
                item.getSubtotal()
        );
    }
}
