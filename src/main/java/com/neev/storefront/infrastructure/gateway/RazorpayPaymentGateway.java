package com.neev.storefront.infrastructure.gateway;

import com.neev.storefront.common.config.StoreProperties;
import com.neev.storefront.common.util.MinorUnits;
import com.neev.storefront.domain.payment.exception.GatewayUnavailableException;
import com.neev.storefront.domain.payment.gateway.GatewayOrder;
import com.neev.storefront.domain.payment.gateway.PaymentGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Razorpay Orders API 연동 게이트웨이
 *
 * POST {baseUrl}/orders (Basic 인증) 요청 본문: {amount(paise), currency, receipt}
 * 연결/읽기 타임아웃을 넘기면 GatewayUnavailableException
 */
@Slf4j
public class RazorpayPaymentGateway implements PaymentGateway {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT =
            new ParameterizedTypeReference<>() {};

    private final RestClient restClient;

    public RazorpayPaymentGateway(StoreProperties.Gateway gateway) {
        this(RestClient.builder()
                .baseUrl(gateway.getBaseUrl())
                .requestFactory(requestFactory(gateway))
                .defaultHeaders(headers -> headers.setBasicAuth(gateway.getKeyId(), gateway.getKeySecret()))
                .build());
    }

    RazorpayPaymentGateway(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public GatewayOrder createOrder(BigDecimal amount, String currency, String receipt) {
        long amountMinorUnits = MinorUnits.toMinorUnits(amount);
        Map<String, Object> response;
        try {
            response = restClient.post()
                    .uri("/orders")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("amount", amountMinorUnits, "currency", currency, "receipt", receipt))
                    .retrieve()
                    .body(JSON_OBJECT);
        } catch (RestClientException e) {
            throw new GatewayUnavailableException("게이트웨이 주문 생성 실패: " + e.getMessage(), e);
        }

        if (response == null || response.get("id") == null) {
            throw new GatewayUnavailableException("게이트웨이 응답에 주문 ID가 없습니다", null);
        }

        String remoteId = String.valueOf(response.get("id"));
        log.info("게이트웨이 주문 생성 - externalId={}, receipt={}", remoteId, receipt);
        return new GatewayOrder(
                remoteId,
                response.get("amount") instanceof Number number ? number.longValue() : amountMinorUnits,
                response.get("currency") != null ? String.valueOf(response.get("currency")) : currency,
                response.get("status") != null ? String.valueOf(response.get("status")) : "created",
                response
        );
    }

    @Override
    public boolean isLive() {
        return true;
    }

    private static SimpleClientHttpRequestFactory requestFactory(StoreProperties.Gateway gateway) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(gateway.getConnectTimeout());
        factory.setReadTimeout(gateway.getReadTimeout());
        return factory;
    }
}
