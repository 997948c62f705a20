package com.neev.storefront.application.order;

import com.neev.storefront.IntegrationTestBase;
import com.neev.storefront.application.order.dto.CheckoutResponse;
import com.neev.storefront.application.order.dto.CreateOrderRequest;
import com.neev.storefront.application.order.dto.OrderDetailResponse;
import com.neev.storefront.application.order.usecase.CreateOrderUseCase;
import com.neev.storefront.application.order.usecase.GetOrderDetailUseCase;
import com.neev.storefront.application.product.dto.ProductRequest;
import com.neev.storefront.application.product.usecase.UpdateProductUseCase;
import com.neev.storefront.domain.cart.Cart;
import com.neev.storefront.domain.order.OrderStatus;
import com.neev.storefront.domain.order.exception.InvalidOrderException;
import com.neev.storefront.domain.payment.PaymentStatus;
import com.neev.storefront.domain.product.entity.Product;
import com.neev.storefront.domain.product.exception.InsufficientStockException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 주문 생성 통합 테스트
 * 주문/항목 스냅샷/재고 차감이 한 번에 반영되는지 검증
 */
@DisplayName("주문 생성 통합 테스트")
class CreateOrderIntegrationTest extends IntegrationTestBase {

    @Autowired
    private CreateOrderUseCase createOrderUseCase;

    @Autowired
    private GetOrderDetailUseCase getOrderDetailUseCase;

    @Autowired
    private UpdateProductUseCase updateProductUseCase;

    @Test
    @DisplayName("UPI 주문 시 재고가 차감되고 결제 대기 주문과 게이트웨이 ID가 생성된다")
    void UPI_주문_생성() {
        // given
        Product product = saveProduct("NEEV-R01", "Round Brilliant 1.0 ct", "24999.00", 5);
        Cart cart = new Cart();
        cart.add(product.getId(), 2);

        // when
        CheckoutResponse response = createOrderUseCase.execute(cart, request("upi"));

        // then
        assertThat(response.totalAmount()).isEqualByComparingTo("49998.00");
        assertThat(response.paymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(response.status()).isEqualTo(OrderStatus.CREATED);
        assertThat(response.externalId()).startsWith("mock_order_");
        assertThat(response.nextPath()).isEqualTo("/upi/" + response.orderId());
        assertThat(stockOf(product.getId())).isEqualTo(3);
        assertThat(cart.isEmpty()).isTrue();

        OrderDetailResponse detail = getOrderDetailUseCase.execute(response.orderId());
        assertThat(detail.items()).hasSize(1);
        assertThat(detail.items().get(0).quantity()).isEqualTo(2);
        assertThat(detail.items().get(0).unitPrice()).isEqualByComparingTo("24999.00");
    }

    @Test
    @DisplayName("이름이 저장 가능한 길이를 넘으면 InvalidOrderException 이고 재고와 주문은 그대로다")
    void 긴_이름_주문() {
        // given
        Product product = saveProduct("NEEV-R09", "Cushion 1.0 ct", "24999.00", 5);
        Cart cart = new Cart();
        cart.add(product.getId(), 1);
        CreateOrderRequest request = new CreateOrderRequest("a".repeat(300), null, "98765", "12 MG Road", "upi");

        // when & then
        assertThatThrownBy(() -> createOrderUseCase.execute(cart, request))
                .isInstanceOf(InvalidOrderException.class);
        assertThat(stockOf(product.getId())).isEqualTo(5);
        assertThat(orderRepository.count()).isZero();
        assertThat(cart.quantityOf(product.getId())).isEqualTo(1);
    }

    @Test
    @DisplayName("프리미엄 옵션을 선택하면 총액에 999.00 이 더해진다")
    void 프리미엄_주문() {
        // given
        Product product = saveProduct("NEEV-R02", "Oval 1.5 ct", "54999.00", 2);
        Cart cart = new Cart();
        cart.add(product.getId(), 1);
        cart.setPremium(true);

        // when
        CheckoutResponse response = createOrderUseCase.execute(cart, request("upi"));

        // then
        assertThat(response.totalAmount()).isEqualByComparingTo("55998.00");
    }

    @Test
    @DisplayName("모의 게이트웨이에서 카드 결제는 즉시 PAID/CONFIRMED 가 된다")
    void 카드_주문_자동_확정() {
        // given
        Product product = saveProduct("NEEV-R03", "Princess 0.8 ct", "18999.00", 1);
        Cart cart = new Cart();
        cart.add(product.getId(), 1);

        // when
        CheckoutResponse response = createOrderUseCase.execute(cart, request("card"));

        // then
        assertThat(response.paymentStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(response.status()).isEqualTo(OrderStatus.CONFIRMED);
        assertThat(response.nextPath()).isEqualTo("/order/" + response.orderId());
    }

    @Test
    @DisplayName("주문 후 상품 가격이 바뀌어도 주문 항목 스냅샷은 그대로다")
    void 가격_스냅샷() {
        // given
        Product product = saveProduct("NEEV-R04", "Emerald 1.2 ct", "24999.00", 5);
        Cart cart = new Cart();
        cart.add(product.getId(), 1);
        CheckoutResponse response = createOrderUseCase.execute(cart, request("upi"));

        // when
        updateProductUseCase.execute(product.getId(),
                new ProductRequest(null, "Emerald 1.2 ct (new)", "Rings", null, new BigDecimal("29999.00"), 4, null));

        // then
        OrderDetailResponse detail = getOrderDetailUseCase.execute(response.orderId());
        assertThat(detail.items().get(0).unitPrice()).isEqualByComparingTo("24999.00");
        assertThat(detail.items().get(0).productName()).isEqualTo("Emerald 1.2 ct");
        assertThat(detail.totalAmount()).isEqualByComparingTo("24999.00");
    }

    @Test
    @DisplayName("한 라인이라도 재고가 부족하면 주문이 생성되지 않고 모든 재고가 유지된다")
    void 재고_부족_롤백() {
        // given
        Product enough = saveProduct("NEEV-R05", "Studs", "9999.00", 5);
        Product scarce = saveProduct("NEEV-R06", "Pendant", "14999.00", 1);
        Cart cart = new Cart();
        cart.add(enough.getId(), 2);
        cart.add(scarce.getId(), 2);

        // when & then
        assertThatThrownBy(() -> createOrderUseCase.execute(cart, request("upi")))
                .isInstanceOf(InsufficientStockException.class);
        assertThat(stockOf(enough.getId())).isEqualTo(5);
        assertThat(stockOf(scarce.getId())).isEqualTo(1);
        assertThat(orderRepository.count()).isZero();
        assertThat(orderItemRepository.count()).isZero();
        assertThat(cart.quantityOf(scarce.getId())).isEqualTo(2);
    }

    private static CreateOrderRequest request(String paymentMethod) {
        return new CreateOrderRequest("Asha Rao", "asha@example.com", "9876543210", "12 MG Road", paymentMethod);
    }
}
