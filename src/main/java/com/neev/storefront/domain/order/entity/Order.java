package com.neev.storefront.domain.order.entity;

import com.neev.storefront.domain.order.OrderStatus;
import com.neev.storefront.domain.order.exception.OrderStateConflictException;
import com.neev.storefront.domain.order.vo.CustomerInfo;
import com.neev.storefront.domain.payment.PaymentMethod;
import com.neev.storefront.domain.payment.PaymentStatus;
import com.neev.storefront.infrastructure.jpa.BaseEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 주문 엔티티
 *
 * 결제 상태(paymentStatus) x 주문 상태(status) 전이:
 * - PENDING/CREATED  -> PAID/CONFIRMED      (웹훅 결제 확인, 관리자 결제 완료, 모의 게이트웨이 카드 자동 확정)
 * - PENDING/CREATED  -> REJECTED/REJECTED   (관리자 거절)
 * - PAID/CONFIRMED   -> PAID/FULFILLED      (처리 완료)
 * 같은 전이를 다시 적용하면 아무것도 바꾸지 않고 false 를 반환한다.
 * 종료 상태를 뒤집는 전이는 OrderStateConflictException 으로 거부한다.
 * 총액(totalAmount)은 생성 시 한 번 계산되며 이후 변경되지 않는다.
 */
@Entity
@Table(name = "orders", indexes = {
        @Index(name = "idx_orders_external_id", columnList = "external_id"),
        @Index(name = "idx_orders_status_created_at", columnList = "status, created_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Order extends BaseEntity {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_id")
    private String externalId;

    @Embedded
    private CustomerInfo customer;

    @Column(name = "premium", nullable = false)
    private boolean premium;

    @Column(name = "total_amount", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal totalAmount;

    @Column(name = "payment_method", nullable = false)
    @Enumerated(EnumType.STRING)
    private PaymentMethod paymentMethod;

    @Column(name = "payment_status", nullable = false)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private PaymentStatus paymentStatus = PaymentStatus.PENDING;

    @Column(name = "status", nullable = false)
    @Enumerated(EnumType.STRING)
    @Builder.Default
    private OrderStatus status = OrderStatus.CREATED;

    @Column(name = "gateway_payload", columnDefinition = "TEXT")
    private String gatewayPayload;

    /**
     * 신규 주문 (PENDING/CREATED)
     */
    public static Order create(CustomerInfo customer, boolean premium, BigDecimal totalAmount, PaymentMethod paymentMethod) {
        return Order.builder()
                .customer(customer)
                .premium(premium)
                .totalAmount(totalAmount)
                .paymentMethod(paymentMethod)
                .paymentStatus(PaymentStatus.PENDING)
                .status(OrderStatus.CREATED)
                .build();
    }

    /**
     * 게이트웨이 원격 주문 연결
     */
    public void attachGatewayOrder(String externalId, String gatewayPayload) {
        this.externalId = externalId;
        this.gatewayPayload = gatewayPayload;
    }

    /**
     * 결제 완료 처리
     *
     * @param payload 결제 확인 원본 (null 이면 기존 payload 유지)
     * @return 상태가 실제로 바뀌었으면 true, 이미 결제 완료면 false
     */
    public boolean markPaid(String payload) {
        if (paymentStatus == PaymentStatus.PAID) {
            return false;
        }
        if (paymentStatus == PaymentStatus.REJECTED) {
            throw new OrderStateConflictException(id, "거절된 주문은 결제 완료로 변경할 수 없습니다");
        }
        this.paymentStatus = PaymentStatus.PAID;
        this.status = OrderStatus.CONFIRMED;
        if (payload != null) {
            this.gatewayPayload = payload;
        }
        return true;
    }

    /**
     * 주문 거절
     *
     * @return 상태가 실제로 바뀌었으면 true, 이미 거절된 주문이면 false
     */
    public boolean reject() {
        if (status == OrderStatus.REJECTED) {
            return false;
        }
        if (paymentStatus == PaymentStatus.PAID) {
            throw new OrderStateConflictException(id, "결제 완료된 주문은 거절할 수 없습니다");
        }
        this.paymentStatus = PaymentStatus.REJECTED;
        this.status = OrderStatus.REJECTED;
        return true;
    }

    /**
     * 처리 완료 (결제 확정된 주문만 가능)
     */
    public boolean fulfill() {
        if (status == OrderStatus.FULFILLED) {
            return false;
        }
        if (status != OrderStatus.CONFIRMED) {
            throw new OrderStateConflictException(id, "결제 확정된 주문만 처리 완료할 수 있습니다");
        }
        this.status = OrderStatus.FULFILLED;
        return true;
    }

    public boolean isPending() {
        return paymentStatus == PaymentStatus.PENDING;
    }
}
