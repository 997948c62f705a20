package com.neev.storefront.infrastructure.config;

import com.neev.storefront.common.config.StoreProperties;
import com.neev.storefront.domain.payment.gateway.PaymentGateway;
import com.neev.storefront.infrastructure.gateway.MockPaymentGateway;
import com.neev.storefront.infrastructure.gateway.RazorpayPaymentGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 결제 게이트웨이 선택
 * key-id / key-secret 이 모두 있으면 Razorpay, 아니면 모의 게이트웨이
 */
@Slf4j
@Configuration
public class PaymentGatewayConfig {

    @Bean
    public PaymentGateway paymentGateway(StoreProperties storeProperties, Clock clock) {
        StoreProperties.Gateway gateway = storeProperties.getGateway();
        if (gateway.hasCredentials()) {
            log.info("Razorpay 게이트웨이 사용 - baseUrl={}", gateway.getBaseUrl());
            return new RazorpayPaymentGateway(gateway);
        }
        log.info("게이트웨이 자격 증명 없음 - 모의 게이트웨이 사용");
        return new MockPaymentGateway(clock);
    }
}
