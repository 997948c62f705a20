package com.neev.storefront.application.order.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.neev.storefront.common.config.StoreProperties;
import com.neev.storefront.domain.order.entity.Order;
import com.neev.storefront.domain.payment.exception.GatewayUnavailableException;
import com.neev.storefront.domain.payment.gateway.GatewayOrder;
import com.neev.storefront.domain.payment.gateway.PaymentGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * 게이트웨이 원격 주문 요청 서비스
 *
 * 주문 트랜잭션 커밋 이후에 호출된다. 게이트웨이 실패는 주문/재고를 되돌리지 않으며
 * 주문은 외부 ID 없이 결제 대기 상태로 남는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayOrderService {

    static final String RECEIPT_PREFIX = "neev_rcpt_";

    private final PaymentGateway paymentGateway;
    private final OrderTransitionService orderTransitionService;
    private final StoreProperties storeProperties;
    private final ObjectMapper objectMapper;

    /**
     * @return 생성된 원격 주문, 게이트웨이 실패 시 empty
     */
    public Optional<GatewayOrder> requestRemoteOrder(Order order) {
        GatewayOrder gatewayOrder;
        try {
            gatewayOrder = paymentGateway.createOrder(
                    order.getTotalAmount(),
                    storeProperties.getCurrency(),
                    RECEIPT_PREFIX + order.getId()
            );
        } catch (GatewayUnavailableException e) {
            log.warn("게이트웨이 주문 생성 실패, 결제 대기 상태 유지 - orderId={}, reason={}",
                    order.getId(), e.getMessage());
            return Optional.empty();
        }

        orderTransitionService.attachGatewayOrder(order.getId(), gatewayOrder.remoteId(), serialize(gatewayOrder));
        return Optional.of(gatewayOrder);
    }

    private String serialize(GatewayOrder gatewayOrder) {
        try {
            return objectMapper.writeValueAsString(gatewayOrder.rawPayload());
        } catch (JsonProcessingException e) {
            log.warn("게이트웨이 응답 직렬화 실패 - externalId={}", gatewayOrder.remoteId(), e);
            return String.valueOf(gatewayOrder.rawPayload());
        }
    }
}
