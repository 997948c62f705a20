package com.neev.storefront.infrastructure.gateway;

import com.neev.storefront.domain.payment.exception.GatewayUnavailableException;
import com.neev.storefront.domain.payment.gateway.GatewayOrder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

@DisplayName("Razorpay 게이트웨이 연동 테스트")
class RazorpayPaymentGatewayTest {

    private MockRestServiceServer server;
    private RazorpayPaymentGateway gateway;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://gateway.test/v1");
        server = MockRestServiceServer.bindTo(builder).build();
        gateway = new RazorpayPaymentGateway(builder.build());
    }

    @Test
    @DisplayName("최소 화폐 단위 금액으로 원격 주문을 만들고 응답 ID를 반환한다")
    void 원격_주문_생성() {
        // given
        server.expect(requestTo("https://gateway.test/v1/orders"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"amount\":4999800,\"currency\":\"INR\",\"receipt\":\"neev_rcpt_1\"}"))
                .andRespond(withSuccess(
                        "{\"id\":\"order_ABC\",\"amount\":4999800,\"currency\":\"INR\",\"status\":\"created\"}",
                        MediaType.APPLICATION_JSON));

        // when
        GatewayOrder order = gateway.createOrder(new BigDecimal("49998.00"), "INR", "neev_rcpt_1");

        // then
        assertThat(order.remoteId()).isEqualTo("order_ABC");
        assertThat(order.amountMinorUnits()).isEqualTo(4999800L);
        assertThat(gateway.isLive()).isTrue();
        server.verify();
    }

    @Test
    @DisplayName("게이트웨이 오류 응답은 GatewayUnavailableException")
    void 게이트웨이_오류() {
        // given
        server.expect(requestTo("https://gateway.test/v1/orders")).andRespond(withServerError());

        // when & then
        assertThatThrownBy(() -> gateway.createOrder(BigDecimal.TEN, "INR", "r"))
                .isInstanceOf(GatewayUnavailableException.class);
    }

    @Test
    @DisplayName("응답에 주문 ID가 없으면 GatewayUnavailableException")
    void 주문_ID_없음() {
        // given
        server.expect(requestTo("https://gateway.test/v1/orders"))
                .andRespond(withSuccess("{\"status\":\"created\"}", MediaType.APPLICATION_JSON));

        // when & then
        assertThatThrownBy(() -> gateway.createOrder(BigDecimal.TEN, "INR", "r"))
                .isInstanceOf(GatewayUnavailableException.class)
                .hasMessageContaining("주문 ID");
    }
}
