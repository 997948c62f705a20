package com.neev.storefront.application.order.usecase;

import com.neev.storefront.application.order.dto.UpiPaymentResponse;
import com.neev.storefront.common.config.StoreProperties;
import com.neev.storefront.domain.order.entity.Order;
import com.neev.storefront.domain.order.exception.OrderNotFoundException;
import com.neev.storefront.domain.order.repository.OrderRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.util.UriUtils;

import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;

/**
 * UPI 결제 딥링크 조회 UseCase
 *
 * upi://pay?pa={payee}&pn={merchant}&am={금액 소수 2자리}&cu={통화}&tn=Order%20{주문ID}
 */
@Service
@RequiredArgsConstructor
public class GetUpiPaymentUseCase {

    private final OrderRepository orderRepository;
    private final StoreProperties storeProperties;

    @Transactional(readOnly = true)
    public UpiPaymentResponse execute(Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        String amount = order.getTotalAmount().setScale(2, RoundingMode.HALF_UP).toPlainString();
        String link = "upi://pay"
                + "?pa=" + encode(storeProperties.getUpi().getPayeeId())
                + "&pn=" + encode(storeProperties.getUpi().getMerchantName())
                + "&am=" + amount
                + "&cu=" + encode(storeProperties.getCurrency())
                + "&tn=" + encode("Order " + order.getId());

        return new UpiPaymentResponse(order.getId(), order.getTotalAmount(), storeProperties.getCurrency(), link);
    }

    private static String encode(String value) {
        return UriUtils.encodeQueryParam(value, StandardCharsets.UTF_8);
    }
}
