package com.neev.storefront.application.cart.dto;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 장바구니 일괄 수정 요청
 *
 * 폼 필드 qty_{상품ID}=수량, premium=on
 * 숫자가 아닌 수량은 0 으로 보고 해당 상품을 제거한다
 */
public record UpdateCartRequest(
        Map<Long, Integer> quantities,
        boolean premium
) {
    private static final String QUANTITY_PREFIX = "qty_";

    public static UpdateCartRequest fromForm(Map<String, String> form) {
        Map<Long, Integer> quantities = new LinkedHashMap<>();
        form.forEach((key, value) -> {
            if (!key.startsWith(QUANTITY_PREFIX)) {
                return;
            }
            Long productId = parseLong(key.substring(QUANTITY_PREFIX.length()));
            if (productId != null) {
                quantities.put(productId, parseQuantity(value));
            }
        });
        return new UpdateCartRequest(quantities, "on".equals(form.get("premium")));
    }

    private static Long parseLong(String value) {
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static int parseQuantity(String value) {
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
