package com.neev.storefront.application.order.usecase;

import com.neev.storefront.application.order.dto.OrderStatusResponse;
import com.neev.storefront.application.order.service.OrderTransitionService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 관리자 결제 완료 처리 UseCase
 * 이미 결제 완료된 주문이면 변경 없이 성공, 거절된 주문이면 OrderStateConflictException
 */
@Service
@RequiredArgsConstructor
public class MarkOrderPaidUseCase {

    private final OrderTransitionService orderTransitionService;

    public OrderStatusResponse execute(Long orderId) {
        return OrderStatusResponse.from(orderTransitionService.markPaid(orderId, null));
    }
}
