package com.neev.storefront.infrastructure.gateway;

import com.neev.storefront.common.util.MinorUnits;
import com.neev.storefront.domain.payment.gateway.GatewayOrder;
import com.neev.storefront.domain.payment.gateway.PaymentGateway;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 모의 결제 게이트웨이 (자격 증명 미설정 시 사용)
 *
 * 원격 ID: mock_order_{epochSeconds}_{sequence}
 * 같은 초에 여러 번 호출되어도 시퀀스로 고유성이 보장된다.
 * 상태는 항상 "created" 이며 결제 완료를 의미하지 않는다.
 */
@Slf4j
public class MockPaymentGateway implements PaymentGateway {

    static final String REMOTE_ID_PREFIX = "mock_order_";

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    public MockPaymentGateway(Clock clock) {
        this.clock = clock;
    }

    @Override
    public GatewayOrder createOrder(BigDecimal amount, String currency, String receipt) {
        long amountMinorUnits = MinorUnits.toMinorUnits(amount);
        String remoteId = REMOTE_ID_PREFIX + clock.instant().getEpochSecond() + "_" + sequence.incrementAndGet();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", remoteId);
        payload.put("amount", amountMinorUnits);
        payload.put("currency", currency);
        payload.put("receipt", receipt);
        payload.put("status", "created");

        log.debug("모의 게이트웨이 주문 생성 - externalId={}, receipt={}", remoteId, receipt);
        return new GatewayOrder(remoteId, amountMinorUnits, currency, "created", payload);
    }

    @Override
    public boolean isLive() {
        return false;
    }
}
