package com.neev.storefront.application.cart.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.math.BigDecimal;
import java.util.List;

/**
 * 장바구니 조회 응답
 * 금액은 조회 시점의 상품 가격으로 계산된다
 */
public record CartResponse(
        @Schema(description = "장바구니 라인 (삭제된 상품 제외)")
        List<CartLineResponse> lines,
        @Schema(description = "라인 소계 합", example = "49998.00")
        BigDecimal subtotal,
        @Schema(description = "프리미엄 옵션 선택 여부", example = "false")
        boolean premium,
        @Schema(description = "프리미엄 옵션 금액", example = "999.00")
        BigDecimal premiumSurcharge,
        @Schema(description = "합계", example = "49998.00")
        BigDecimal total
) {
    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
