package com.neev.storefront.domain.payment.gateway;

import com.neev.storefront.domain.payment.exception.GatewayUnavailableException;

import java.math.BigDecimal;

/**
 * 결제 게이트웨이 포트
 *
 * 원격 결제 주문(order shell)을 생성한다. 결제 성공을 의미하지 않으며
 * 실제 결제 확인은 웹훅 또는 관리자 처리로 이루어진다.
 */
public interface PaymentGateway {

    /**
     * 원격 결제 주문 생성
     *
     * @param amount 주문 금액 (최소 화폐 단위로 변환되어 전송됨)
     * @param currency 통화 코드
     * @param receipt 가맹점 영수증 ID
     * @throws GatewayUnavailableException 게이트웨이 호출 실패/타임아웃
     */
    GatewayOrder createOrder(BigDecimal amount, String currency, String receipt);

    /**
     * 실제 게이트웨이 자격 증명으로 동작하는지 여부 (false 이면 모의 게이트웨이)
     */
    boolean isLive();
}
