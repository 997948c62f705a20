package com.neev.storefront.domain.cart.service;

import com.neev.storefront.common.config.StoreProperties;
import com.neev.storefront.domain.cart.CartLine;
import com.neev.storefront.domain.product.entity.Product;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 장바구니 금액 계산 도메인 서비스
 *
 * (수량 매핑, 상품 스냅샷) -> 장바구니 라인/합계를 계산하는 순수 함수 모음
 * - 삭제된 상품을 가리키는 라인은 조용히 제외한다
 * - 가격은 담은 시점이 아니라 계산 시점의 상품 가격을 사용한다
 */
@Service
public class CartCalculator {

    private final BigDecimal premiumSurcharge;

    public CartCalculator(StoreProperties storeProperties) {
        this.premiumSurcharge = storeProperties.getPremiumSurcharge();
    }

    /**
     * 장바구니 라인 계산
     *
     * @param quantities 상품 ID -> 수량 (장바구니 순서 유지)
     * @param products 현재 카탈로그에서 조회한 상품들
     * @return 존재하는 상품에 대한 라인 목록
     */
    public List<CartLine> lines(Map<Long, Integer> quantities, Collection<Product> products) {
        Map<Long, Product> productById = products.stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));

        List<CartLine> lines = new ArrayList<>();
        quantities.forEach((productId, quantity) -> {
            Product product = productById.get(productId);
            if (product == null || quantity == null || quantity <= 0) {
                return;
            }
            BigDecimal subtotal = product.getPrice().multiply(BigDecimal.valueOf(quantity));
            lines.add(new CartLine(product.getId(), product.getName(), product.getPrice(), quantity, subtotal));
        });
        return lines;
    }

    public BigDecimal subtotal(List<CartLine> lines) {
        return lines.stream()
                .map(CartLine::subtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * 합계 = 라인 소계 합 + (프리미엄 선택 시) 고정 추가금
     */
    public BigDecimal total(List<CartLine> lines, boolean premium) {
        BigDecimal subtotal = subtotal(lines);
        return premium ? subtotal.add(premiumSurcharge) : subtotal;
    }

    public BigDecimal getPremiumSurcharge() {
        return premiumSurcharge;
    }
}
