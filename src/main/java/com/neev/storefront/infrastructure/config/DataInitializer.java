package com.neev.storefront.infrastructure.config;

import com.neev.storefront.domain.product.entity.Product;
import com.neev.storefront.domain.product.repository.ProductRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.util.List;

/**
 * 샘플 상품 시드 (카탈로그가 비어 있을 때만)
 */
@Slf4j
@Configuration
@ConditionalOnProperty(prefix = "neev.seed", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DataInitializer {

    @Bean
    public CommandLineRunner seedCatalog(ProductRepository productRepository) {
        return args -> {
            if (productRepository.count() > 0) {
                log.debug("상품이 이미 존재하여 시드를 건너뜀");
                return;
            }

            List<Product> products = List.of(
                    Product.create("NEEV-R01", "Round Brilliant 1.0 ct", "Rings", "E/VS1 IGI Certified",
                            new BigDecimal("24999.00"), 5, "https://images.unsplash.com/photo-1523292562811-8fa7962a78c8?q=80&w=1200&auto=format&fit=crop"),
                    Product.create("NEEV-P02", "Princess Cut 0.75 ct", "Pendants", "F/VVS2 IGI Certified",
                            new BigDecimal("19999.00"), 8, "https://images.unsplash.com/photo-1520962918319-47adfa87ee1b?q=80&w=1200&auto=format&fit=crop"),
                    Product.create("NEEV-O03", "Oval 1.5 ct", "Rings", "D/VS2 IGI Certified",
                            new BigDecimal("44999.00"), 2, "https://images.unsplash.com/photo-1516637090014-cb1ab0d08fc7?q=80&w=1200&auto=format&fit=crop"),
                    Product.create("NEEV-C04", "Cushion 1.2 ct", "Earrings", "G/VS1 IGI Certified",
                            new BigDecimal("28999.00"), 3, "https://images.unsplash.com/photo-1502082553048-f009c37129b9?q=80&w=1200&auto=format&fit=crop")
            );
            productRepository.saveAll(products);
            log.info("샘플 상품 {}건 등록 완료", products.size());
        };
    }
}
