package com.neev.storefront.application.order.usecase;

import com.neev.storefront.application.order.dto.OrderStatusResponse;
import com.neev.storefront.application.order.service.OrderTransitionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 주문 처리 완료 UseCase
 * 결제 확정(CONFIRMED) 주문만 처리 완료로 바꿀 수 있다
 */
@Service
@RequiredArgsConstructor
public class FulfillOrderUseCase {

    private final OrderTransitionService orderTransitionService;

    public OrderStatusResponse execute(Long orderId) {
        return OrderStatusResponse.from(orderTransitionService.fulfill(orderId));
    }
}
