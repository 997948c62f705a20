package com.neev.storefront.presentation.controller.admin;

import com.neev.storefront.IntegrationTestBase;
import com.neev.storefront.application.order.dto.CheckoutResponse;
import com.neev.storefront.application.order.dto.CreateOrderRequest;
import com.neev.storefront.application.order.usecase.CreateOrderUseCase;
import com.neev.storefront.domain.cart.Cart;
import com.neev.storefront.domain.product.entity.Product;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 관리자 흐름 통합 테스트
 * 로그인 -> 주문 상태 변경 -> 고객 주문 조회
 */
@AutoConfigureMockMvc
@DisplayName("관리자 흐름 통합 테스트")
class AdminFlowIntegrationTest extends IntegrationTestBase {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private CreateOrderUseCase createOrderUseCase;

    private CheckoutResponse checkout;

    @BeforeEach
    void setUp() {
        Product product = saveProduct("ADM-1", "Oval 1.5 ct", "54999.00", 3);
        Cart cart = new Cart();
        cart.add(product.getId(), 1);
        checkout = createOrderUseCase.execute(cart,
                new CreateOrderRequest("Asha", null, "98765", "12 MG Road", "upi"));
    }

    @Test
    @DisplayName("로그인하지 않으면 원래 경로를 next 로 담아 로그인 화면으로 보낸다")
    void 미인증_리다이렉트() throws Exception {
        mockMvc.perform(post("/admin/order/{orderId}/reject", checkout.orderId()))
                .andExpect(status().is3xxRedirection())
                .andExpect(header().string("Location",
                        "/admin/login?next=/admin/order/" + checkout.orderId() + "/reject"));
    }

    @Test
    @DisplayName("관리자가 거절한 주문은 고객 화면에 거절 안내가 표시된다")
    void 로그인_후_거절() throws Exception {
        // given
        MockHttpSession session = new MockHttpSession();
        mockMvc.perform(post("/admin/login").session(session)
                        .param("password", "2468")
                        .param("next", "/admin"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "/admin"));

        // when
        mockMvc.perform(post("/admin/order/{orderId}/reject", checkout.orderId()).session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.paymentStatus").value("REJECTED"))
                .andExpect(jsonPath("$.changed").value(true));

        // then
        mockMvc.perform(get("/order/{orderId}", checkout.orderId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REJECTED"))
                .andExpect(jsonPath("$.statusMessage").value("결제가 거절되어 주문이 취소되었습니다"));

        // 거절된 주문을 결제 완료로 바꿀 수 없다
        mockMvc.perform(post("/admin/order/{orderId}/mark_paid", checkout.orderId()).session(session))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("외부 주소를 next 로 넘기면 /admin 으로 보낸다")
    void 외부_리다이렉트_차단() throws Exception {
        mockMvc.perform(post("/admin/login")
                        .param("password", "2468")
                        .param("next", "//evil.example.com"))
                .andExpect(status().isFound())
                .andExpect(header().string("Location", "/admin"));
    }
}
