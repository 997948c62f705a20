package com.neev.storefront.application.order.usecase;

import com.neev.storefront.application.order.dto.CheckoutResponse;
import com.neev.storefront.application.order.dto.CreateOrderRequest;
import com.neev.storefront.application.order.service.CreateOrderService;
import com.neev.storefront.application.order.service.GatewayOrderService;
import com.neev.storefront.application.order.service.OrderTransitionService;
import com.neev.storefront.domain.cart.Cart;
import com.neev.storefront.domain.cart.exception.EmptyCartException;
import com.neev.storefront.domain.order.entity.Order;
import com.neev.storefront.domain.order.exception.OrderStateConflictException;
import com.neev.storefront.domain.order.repository.OrderRepository;
import com.neev.storefront.domain.order.vo.CustomerInfo;
import com.neev.storefront.domain.payment.PaymentMethod;
import com.neev.storefront.domain.payment.gateway.PaymentGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 주문 생성(결제) 유스케이스
 *
 * 1. 장바구니/주문자 정보 검증
 * 2. 주문 + 주문 항목 + 재고 차감 (CreateOrderService, 단일 트랜잭션)
 * 3. 장바구니 비우기 (주문 커밋 직후)
 * 4. 게이트웨이 원격 주문 요청 (실패해도 주문은 유지)
 * 5. 모의 게이트웨이 + 카드 결제는 즉시 결제 완료 처리
 *
 * 재고 부족 등으로 2단계가 실패하면 장바구니는 그대로 남는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreateOrderUseCase {

    private final CreateOrderService createOrderService;
    private final GatewayOrderService gatewayOrderService;
    private final OrderTransitionService orderTransitionService;
    private final PaymentGateway paymentGateway;
    private final OrderRepository orderRepository;

    public CheckoutResponse execute(Cart cart, CreateOrderRequest request) {
        // 1. 검증
        if (cart.isEmpty()) {
            throw new EmptyCartException();
        }
        CustomerInfo customer = CustomerInfo.of(request.name(), request.email(), request.phone(), request.address());
        PaymentMethod paymentMethod = PaymentMethod.from(request.paymentMethod());

        // 2. 주문 생성 (트랜잭션)
        Order order = createOrderService.create(customer, paymentMethod, cart.quantities(), cart.isPremium());

        // 3. 장바구니 비우기
        cart.clear();

        // 4. 게이트웨이 원격 주문
        gatewayOrderService.requestRemoteOrder(order);

        // 5. 데모 모드 카드 결제 자동 확정
        if (paymentMethod == PaymentMethod.CARD && !paymentGateway.isLive()) {
            try {
                orderTransitionService.markPaid(order.getId(), null);
            } catch (OrderStateConflictException e) {
                log.warn("카드 결제 자동 확정 실패 - orderId: {}, reason: {}", order.getId(), e.getMessage());
            }
        }

        Order saved = orderRepository.findById(order.getId()).orElse(order);
        return CheckoutResponse.from(saved);
    }
}
