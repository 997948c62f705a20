package com.neev.storefront.application.cart.dto;

import com.neev.storefront.domain.cart.CartLine;
import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;

public record CartLineResponse(
        @Schema(description = "상품 ID", example = "1")
        Long productId,
        @Schema(description = "상품명", example = "Round Brilliant 1.0 ct")
        String productName,
        @Schema(description = "현재 단가", example = "24999.00")
        BigDecimal unitPrice,
        @Schema(description = "수량", example = "2")
        int quantity,
        @Schema(description = "소계", example = "49998.00")
        BigDecimal subtotal
) {
    public static CartLineResponse from(CartLine line) {
        return new CartLineResponse(line.productId(), line.productName(), line.unitPrice(), line.quantity(), line.subtotal());
    }
}
