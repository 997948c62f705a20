package com.neev.storefront.domain.cart;

import java.math.BigDecimal;

/**
 * 조회 시점 가격으로 계산된 장바구니 한 줄
 */
public record CartLine(
        Long productId,
        String productName,
        BigDecimal unitPrice,
        int quantity,
        BigDecimal subtotal
) {
}
