package com.neev.storefront.application.order.service;

import com.neev.storefront.domain.order.entity.Order;
import com.neev.storefront.domain.order.exception.OrderNotFoundException;
import com.neev.storefront.domain.order.exception.OrderStateConflictException;
import com.neev.storefront.domain.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 주문 상태 전이 서비스
 *
 * 모든 전이는 주문 행을 비관적 락(SELECT ... FOR UPDATE)으로 읽은 뒤 수행한다.
 * 웹훅, 관리자, 결제 흐름이 같은 주문을 동시에 건드려도 직렬화된다.
 *
 * @throws OrderNotFoundException 주문이 없는 경우
 * @throws OrderStateConflictException 종료 상태를 뒤집으려는 경우
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderTransitionService {

    private final OrderRepository orderRepository;

    @Transactional
    public TransitionResult markPaid(Long orderId, String payload) {
        Order order = loadForUpdate(orderId);
        boolean changed = order.markPaid(payload);
        logTransition("결제 완료", order, changed);
        return new TransitionResult(order, changed);
    }

    @Transactional
    public TransitionResult reject(Long orderId) {
        Order order = loadForUpdate(orderId);
        boolean changed = order.reject();
        logTransition("주문 거절", order, changed);
        return new TransitionResult(order, changed);
    }

    @Transactional
    public TransitionResult fulfill(Long orderId) {
        Order order = loadForUpdate(orderId);
        boolean changed = order.fulfill();
        logTransition("처리 완료", order, changed);
        return new TransitionResult(order, changed);
    }

    /**
     * 게이트웨이 주문 ID로 결제 완료 처리
     *
     * @return 일치하는 주문이 없으면 empty
     */
    @Transactional
    public Optional<TransitionResult> markPaidByExternalId(String externalId, String payload) {
        List<Order> orders = orderRepository.findByExternalIdWithLock(externalId);
        if (orders.isEmpty()) {
            return Optional.empty();
        }
        if (orders.size() > 1) {
            log.warn("같은 게이트웨이 주문 ID를 가진 주문이 여러 건 - externalId={}, count={}", externalId, orders.size());
        }

        Order order = orders.get(0);
        boolean changed = order.markPaid(payload);
        logTransition("웹훅 결제 완료", order, changed);
        return Optional.of(new TransitionResult(order, changed));
    }

    /**
     * 게이트웨이 원격 주문 ID/응답 저장
     */
    @Transactional
    public void attachGatewayOrder(Long orderId, String externalId, String payload) {
        Order order = loadForUpdate(orderId);
        order.attachGatewayOrder(externalId, payload);
        log.info("게이트웨이 주문 연결 - orderId={}, externalId={}", orderId, externalId);
    }

    private Order loadForUpdate(Long orderId) {
        return orderRepository.findByIdWithLock(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    private void logTransition(String action, Order order, boolean changed) {
        if (changed) {
            log.info("{} - orderId={}, paymentStatus={}, status={}",
                    action, order.getId(), order.getPaymentStatus(), order.getStatus());
        } else {
            log.debug("{} 요청 무시 (이미 같은 상태) - orderId={}", action, order.getId());
        }
    }

    /**
     * @param changed 이번 호출로 상태가 바뀌었으면 true
     */
    public record TransitionResult(Order order, boolean changed) {}
}
