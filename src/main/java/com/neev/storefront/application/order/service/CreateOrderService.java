package com.neev.storefront.application.order.service;

import com.neev.storefront.application.product.service.ProductStockService;
import com.neev.storefront.domain.cart.CartLine;
import com.neev.storefront.domain.order.entity.Order;
import com.neev.storefront.domain.order.entity.OrderItem;
import com.neev.storefront.domain.order.repository.OrderItemRepository;
import com.neev.storefront.domain.order.repository.OrderRepository;
import com.neev.storefront.domain.order.service.OrderItemPreparationService;
import com.neev.storefront.domain.order.service.OrderItemPreparationService.OrderPreparation;
import com.neev.storefront.domain.order.vo.CustomerInfo;
import com.neev.storefront.domain.payment.PaymentMethod;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * 주문 생성 트랜잭션 처리 서비스
 *
 * 주문 저장, 주문 항목 스냅샷 저장, 재고 차감을 하나의 트랜잭션으로 처리한다.
 * 어느 한 라인이라도 재고가 부족하면 전체가 롤백된다.
 * 재고 차감은 상품 ID 오름차순으로 수행하여 동시 주문 간 잠금 순서를 일정하게 유지한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreateOrderService {

    private final OrderItemPreparationService orderItemPreparationService;
    private final ProductStockService productStockService;
    private final OrderRepository orderRepository;
    private final OrderItemRepository orderItemRepository;

    @Transactional
    public Order create(CustomerInfo customer, PaymentMethod paymentMethod,
                        Map<Long, Integer> quantities, boolean premium) {
        // 1. 현재 카탈로그 기준 라인/총액 계산
        OrderPreparation preparation = orderItemPreparationService.prepare(quantities, premium);

        // 2. 주문 저장 (PENDING/CREATED)
        Order order = orderRepository.save(
                Order.create(customer, premium, preparation.totalAmount(), paymentMethod)
        );

        // 3. 주문 항목 스냅샷 저장
        List<OrderItem> items = preparation.lines().stream()
                .map(line -> OrderItem.snapshotOf(order.getId(), line))
                .toList();
        orderItemRepository.saveAll(items);

        // 4. 재고 차감 (조건부 UPDATE)
        for (CartLine line : preparation.lines()) {
            productStockService.decrease(line.productId(), line.quantity());
        }

        log.info("주문 생성 - orderId={}, total={}, items={}, paymentMethod={}",
                order.getId(), order.getTotalAmount(), items.size(), paymentMethod);
        return order;
    }
}
