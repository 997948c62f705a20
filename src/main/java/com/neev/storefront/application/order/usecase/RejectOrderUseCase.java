package com.neev.storefront.application.order.usecase;

import com.neev.storefront.application.order.dto.OrderStatusResponse;
import com.neev.storefront.application.order.service.OrderTransitionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 관리자 주문 거절 UseCase
 * 재고는 복원하지 않는다. 이미 거절된 주문이면 변경 없이 성공
 */
@Service
@RequiredArgsConstructor
public class RejectOrderUseCase {

    private final OrderTransitionService orderTransitionService;

    public OrderStatusResponse execute(Long orderId) {
        return OrderStatusResponse.from(orderTransitionService.reject(orderId));
    }
}
