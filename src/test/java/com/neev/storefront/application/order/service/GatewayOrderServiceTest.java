package com.neev.storefront.application.order.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.neev.storefront.common.config.StoreProperties;
import com.neev.storefront.domain.order.entity.Order;
import com.neev.storefront.domain.order.vo.CustomerInfo;
import com.neev.storefront.domain.payment.PaymentMethod;
import com.neev.storefront.domain.payment.exception.GatewayUnavailableException;
import com.neev.storefront.domain.payment.gateway.GatewayOrder;
import com.neev.storefront.domain.payment.gateway.PaymentGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("게이트웨이 원격 주문 요청 테스트")
class GatewayOrderServiceTest {

    @Mock
    private PaymentGateway paymentGateway;

    @Mock
    private OrderTransitionService orderTransitionService;

    private GatewayOrderService service;
    private Order order;

    @BeforeEach
    void setUp() {
        service = new GatewayOrderService(paymentGateway, orderTransitionService, new StoreProperties(), new ObjectMapper());
        order = Order.create(CustomerInfo.of("Asha", null, "98765", "addr"), false,
                new BigDecimal("49998.00"), PaymentMethod.UPI);
        ReflectionTestUtils.setField(order, "id", 7L);
    }

    @Test
    @DisplayName("원격 주문을 만들고 ID와 응답 원문을 주문에 연결한다")
    void 원격_주문_연결() {
        // given
        GatewayOrder gatewayOrder = new GatewayOrder("mock_order_1_1", 4999800L, "INR", "created",
                Map.of("id", "mock_order_1_1"));
        given(paymentGateway.createOrder(new BigDecimal("49998.00"), "INR", "neev_rcpt_7")).willReturn(gatewayOrder);

        // when
        Optional<GatewayOrder> result = service.requestRemoteOrder(order);

        // then
        assertThat(result).contains(gatewayOrder);
        verify(orderTransitionService).attachGatewayOrder(eq(7L), eq("mock_order_1_1"), contains("mock_order_1_1"));
    }

    @Test
    @DisplayName("게이트웨이가 실패해도 예외 없이 empty 를 반환하고 주문을 건드리지 않는다")
    void 게이트웨이_실패() {
        // given
        given(paymentGateway.createOrder(any(), anyString(), anyString()))
                .willThrow(new GatewayUnavailableException("timeout", null));

        // when
        Optional<GatewayOrder> result = service.requestRemoteOrder(order);

        // then
        assertThat(result).isEmpty();
        verify(orderTransitionService, never()).attachGatewayOrder(anyLong(), anyString(), anyString());
    }
}
