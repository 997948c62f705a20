package com.neev.storefront;

import com.neev.storefront.domain.order.repository.OrderItemRepository;
import com.neev.storefront.domain.order.repository.OrderRepository;
import com.neev.storefront.domain.product.entity.Product;
import com.neev.storefront.domain.product.repository.ProductRepository;
import com.neev.storefront.domain.webhook.repository.WebhookEventRepository;
import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;

/**
 * H2(MySQL 모드) 기반 통합 테스트 공통 설정
 *
 * 동시성 테스트가 커밋된 데이터를 봐야 하므로 테스트 트랜잭션을 쓰지 않고
 * 매 테스트 후 테이블을 비운다.
 */
@SpringBootTest
@ActiveProfiles("test")
public abstract class IntegrationTestBase {

    @Autowired
    protected ProductRepository productRepository;

    @Autowired
    protected OrderRepository orderRepository;

    @Autowired
    protected OrderItemRepository orderItemRepository;

    @Autowired
    protected WebhookEventRepository webhookEventRepository;

    @AfterEach
    void cleanUp() {
        webhookEventRepository.deleteAll();
        orderItemRepository.deleteAll();
        orderRepository.deleteAll();
        productRepository.deleteAll();
    }

    protected Product saveProduct(String sku, String name, String price, int stock) {
        return productRepository.save(
                Product.create(sku, name, "Rings", "IGI Certified", new BigDecimal(price), stock, null)
        );
    }

    protected int stockOf(Long productId) {
        return productRepository.findById(productId).orElseThrow().getStock().quantity();
    }
}
