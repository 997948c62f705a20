package com.neev.storefront.application.order.usecase;

import com.neev.storefront.application.order.dto.UpiPaymentResponse;
import com.neev.storefront.common.config.StoreProperties;
import com.neev.storefront.domain.order.entity.Order;
import com.neev.storefront.domain.order.exception.OrderNotFoundException;
import com.neev.storefront.domain.order.repository.OrderRepository;
import com.neev.storefront.domain.order.vo.CustomerInfo;
import com.neev.storefront.domain.payment.PaymentMethod;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
@DisplayName("UPI 결제 딥링크 테스트")
class GetUpiPaymentUseCaseTest {

    @Mock
    private OrderRepository orderRepository;

    private GetUpiPaymentUseCase useCase;

    @BeforeEach
    void setUp() {
        StoreProperties storeProperties = new StoreProperties();
        storeProperties.getUpi().setPayeeId("neev@upi");
        storeProperties.getUpi().setMerchantName("NEEV Diamonds");
        useCase = new GetUpiPaymentUseCase(orderRepository, storeProperties);
    }

    @Test
    @DisplayName("금액은 소수 둘째 자리까지, 문자열 값은 URL 인코딩된다")
    void 딥링크_생성() {
        // given
        Order order = Order.create(CustomerInfo.of("Asha", null, "98765", "addr"), true,
                new BigDecimal("25998"), PaymentMethod.UPI);
        ReflectionTestUtils.setField(order, "id", 42L);
        given(orderRepository.findById(42L)).willReturn(Optional.of(order));

        // when
        UpiPaymentResponse response = useCase.execute(42L);

        // then
        assertThat(response.upiLink())
                .isEqualTo("upi://pay?pa=neev@upi&pn=NEEV%20Diamonds&am=25998.00&cu=INR&tn=Order%2042");
        assertThat(response.currency()).isEqualTo("INR");
    }

    @Test
    @DisplayName("없는 주문은 OrderNotFoundException")
    void 주문_없음() {
        // given
        given(orderRepository.findById(1L)).willReturn(Optional.empty());

        // when & then
        assertThatThrownBy(() -> useCase.execute(1L))
                .isInstanceOf(OrderNotFoundException.class);
    }
}
