package com.neev.storefront.application.order.usecase;

import com.neev.storefront.application.order.dto.OrderDetailResponse;
import com.neev.storefront.domain.order.entity.Order;
import com.neev.storefront.domain.order.exception.OrderNotFoundException;
import com.neev.storefront.domain.order.repository.OrderItemRepository;
import com.neev.storefront.domain.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 주문 상태 조회 UseCase
 */
@Service
@RequiredArgsConstructor
public class GetOrderDetailUseCase {

    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;

    @Transactional(readOnly = true)
    public OrderDetailResponse execute(Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
        return OrderDetailResponse.from(order, orderItemRepository.findByOrderIdOrderByIdAsc(orderId));
    }
}
