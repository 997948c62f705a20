package com.neev.storefront.domain.order.service;

import com.neev.storefront.common.config.StoreProperties;
import com.neev.storefront.domain.cart.exception.EmptyCartException;
import com.neev.storefront.domain.cart.service.CartCalculator;
import com.neev.storefront.domain.order.service.OrderItemPreparationService.OrderPreparation;
import com.neev.storefront.domain.product.entity.Product;
import com.neev.storefront.domain.product.exception.InsufficientStockException;
import com.neev.storefront.domain.product.repository.ProductRepository;
import com.neev.storefront.domain.product.vo.Stock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
@DisplayName("주문 항목 준비 테스트")
class OrderItemPreparationServiceTest {

    @Mock
    private ProductRepository productRepository;

    private OrderItemPreparationService service;

    @BeforeEach
    void setUp() {
        service = new OrderItemPreparationService(productRepository, new CartCalculator(new StoreProperties()));
    }

    @Test
    @DisplayName("라인은 상품 ID 오름차순이고 프리미엄 금액이 총액에 더해진다")
    void 라인_정렬_총액() {
        // given
        Map<Long, Integer> quantities = new LinkedHashMap<>();
        quantities.put(3L, 1);
        quantities.put(1L, 2);
        given(productRepository.findAllById(any()))
                .willReturn(List.of(product(3L, "44999.00", 5), product(1L, "24999.00", 5)));

        // when
        OrderPreparation preparation = service.prepare(quantities, true);

        // then
        assertThat(preparation.lines()).extracting("productId").containsExactly(1L, 3L);
        assertThat(preparation.totalAmount()).isEqualByComparingTo("95996.00");
    }

    @Test
    @DisplayName("모든 라인의 상품이 삭제되었으면 EmptyCartException")
    void 남은_라인_없음() {
        // given
        given(productRepository.findAllById(any())).willReturn(List.of());

        // when & then
        assertThatThrownBy(() -> service.prepare(Map.of(9L, 1), false))
                .isInstanceOf(EmptyCartException.class);
    }

    @Test
    @DisplayName("빈 장바구니는 조회 없이 EmptyCartException")
    void 빈_장바구니() {
        assertThatThrownBy(() -> service.prepare(Map.of(), false))
                .isInstanceOf(EmptyCartException.class);
    }

    @Test
    @DisplayName("재고보다 많이 담긴 라인이 있으면 InsufficientStockException")
    void 재고_부족() {
        // given
        given(productRepository.findAllById(any())).willReturn(List.of(product(1L, "24999.00", 1)));

        // when & then
        assertThatThrownBy(() -> service.prepare(Map.of(1L, 2), false))
                .isInstanceOf(InsufficientStockException.class)
                .hasMessageContaining("Product 1");
    }

    private static Product product(Long id, String price, int stock) {
        return Product.builder()
                .id(id)
                .sku("SKU" + id)
                .name("Product " + id)
                .category("Rings")
                .price(new BigDecimal(price))
                .stock(new Stock(stock))
                .build();
    }
}
