package com.neev.storefront.domain.order.service;

import com.neev.storefront.domain.cart.CartLine;
import com.neev.storefront.domain.cart.exception.EmptyCartException;
import com.neev.storefront.domain.cart.service.CartCalculator;
import com.neev.storefront.domain.product.entity.Product;
import com.neev.storefront.domain.product.exception.InsufficientStockException;
import com.neev.storefront.domain.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 주문 항목 준비 서비스
 *
 * 장바구니 수량 매핑으로부터 주문 라인과 총액을 준비하는 도메인 서비스
 * - 가격/상품명은 지금 이 순간의 카탈로그에서 읽는다
 * - 삭제된 상품 라인은 제외, 남은 라인이 없으면 EmptyCartException
 * - 재고 사전 확인 (실제 차감은 조건부 UPDATE 로 다시 검증됨)
 */
@Service
@RequiredArgsConstructor
public class OrderItemPreparationService {

    private final ProductRepository productRepository;
    private final CartCalculator cartCalculator;

    /**
     * 주문 항목 준비
     *
     * @param quantities 장바구니 상품 ID -> 수량
     * @param premium 프리미엄 옵션 여부
     * @return 상품 ID 오름차순으로 정렬된 라인과 총액
     */
    public OrderPreparation prepare(Map<Long, Integer> quantities, boolean premium) {
        if (quantities.isEmpty()) {
            throw new EmptyCartException();
        }

        List<Product> products = productRepository.findAllById(quantities.keySet());
        List<CartLine> lines = cartCalculator.lines(quantities, products).stream()
                .sorted(Comparator.comparing(CartLine::productId))
                .toList();
        if (lines.isEmpty()) {
            throw new EmptyCartException();
        }

        Map<Long, Product> productById = products.stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));
        for (CartLine line : lines) {
            Product product = productById.get(line.productId());
            if (!product.canAddToCart(line.quantity())) {
                throw new InsufficientStockException(
                        "상품 재고가 부족합니다: " + product.getName() +
                        " (요청: " + line.quantity() + ", 재고: " + product.getStock().quantity() + ")"
                );
            }
        }

        BigDecimal totalAmount = cartCalculator.total(lines, premium);
        return new OrderPreparation(lines, totalAmount);
    }

    /**
     * 주문 준비 결과
     */
    public record OrderPreparation(
            List<CartLine> lines,
            BigDecimal totalAmount
    ) {}
}
