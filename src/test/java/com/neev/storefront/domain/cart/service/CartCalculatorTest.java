package com.neev.storefront.domain.cart.service;

import com.neev.storefront.common.config.StoreProperties;
import com.neev.storefront.domain.cart.CartLine;
import com.neev.storefront.domain.product.entity.Product;
import com.neev.storefront.domain.product.vo.Stock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("장바구니 금액 계산 테스트")
class CartCalculatorTest {

    private CartCalculator cartCalculator;
    private Product round;
    private Product oval;

    @BeforeEach
    void setUp() {
        cartCalculator = new CartCalculator(new StoreProperties());
        round = product(1L, "Round Brilliant 1.0 ct", "24999.00");
        oval = product(3L, "Oval 1.5 ct", "44999.00");
    }

    @Test
    @DisplayName("라인 소계는 수량 x 현재 가격이다")
    void 라인_소계() {
        // given
        Map<Long, Integer> quantities = new LinkedHashMap<>();
        quantities.put(1L, 2);
        quantities.put(3L, 1);

        // when
        List<CartLine> lines = cartCalculator.lines(quantities, List.of(round, oval));

        // then
        assertThat(lines).hasSize(2);
        assertThat(lines.get(0).subtotal()).isEqualByComparingTo("49998.00");
        assertThat(lines.get(1).subtotal()).isEqualByComparingTo("44999.00");
        assertThat(cartCalculator.subtotal(lines)).isEqualByComparingTo("94997.00");
    }

    @Test
    @DisplayName("삭제된 상품을 가리키는 라인은 조용히 제외된다")
    void 삭제된_상품_제외() {
        // given
        Map<Long, Integer> quantities = new LinkedHashMap<>();
        quantities.put(1L, 1);
        quantities.put(99L, 5);

        // when
        List<CartLine> lines = cartCalculator.lines(quantities, List.of(round));

        // then
        assertThat(lines).extracting(CartLine::productId).containsExactly(1L);
        assertThat(cartCalculator.total(lines, false)).isEqualByComparingTo("24999.00");
    }

    @Test
    @DisplayName("프리미엄 옵션을 선택하면 고정 금액이 더해진다")
    void 프리미엄_합계() {
        // given
        List<CartLine> lines = cartCalculator.lines(Map.of(1L, 2), List.of(round));

        // when & then
        assertThat(cartCalculator.total(lines, false)).isEqualByComparingTo("49998.00");
        assertThat(cartCalculator.total(lines, true)).isEqualByComparingTo("50997.00");
    }

    @Test
    @DisplayName("빈 장바구니의 합계는 0 이다")
    void 빈_장바구니() {
        // when
        List<CartLine> lines = cartCalculator.lines(Map.of(), List.of(round));

        // then
        assertThat(cartCalculator.total(lines, false)).isEqualByComparingTo(BigDecimal.ZERO);
    }

    private static Product product(Long id, String name, String price) {
        return Product.builder()
                .id(id)
                .sku("SKU" + id)
                .name(name)
                .category("Rings")
                .price(new BigDecimal(price))
                .stock(new Stock(10))
                .build();
    }
}
