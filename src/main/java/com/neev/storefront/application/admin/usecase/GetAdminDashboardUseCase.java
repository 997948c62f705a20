package com.neev.storefront.application.admin.usecase;

import com.neev.storefront.application.admin.dto.AdminDashboardResponse;
import com.neev.storefront.application.order.dto.OrderSummaryResponse;
import com.neev.storefront.application.product.dto.ProductResponse;
import com.neev.storefront.domain.order.repository.OrderRepository;
import com.neev.storefront.domain.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 관리자 대시보드 조회 UseCase
 */
@Service
@RequiredArgsConstructor
public class GetAdminDashboardUseCase {

    private final OrderRepository orderRepository;
    private final ProductRepository productRepository;

    @Transactional(readOnly = true)
    public AdminDashboardResponse execute() {
        return new AdminDashboardResponse(
                orderRepository.findTop200ByOrderByIdDesc().stream()
                        .map(OrderSummaryResponse::from)
                        .toList(),
                productRepository.findAll(Sort.by(Sort.Direction.DESC, "id")).stream()
                        .map(ProductResponse::from)
                        .toList()
        );
    }
}
