package com.storefront.commerce.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 주문 항목 스냅샷과 총액 보관
 * - 주문 상태 / 결제 상태 전환
 *
 * 핵심 비즈니스 규칙:
 * - 생성 시 PENDING / PENDING 상태
 * - 생성 이후 항목, 총액, 사용자는 변경 불가 (updatable = false, setter 없음)
 * - 생성 이후에는 orderStatus, paymentStatus만 전환됨
 * - (user_id, checkout_key) 조합은 유일 (같은 멱등성 키로 주문이 두 번 생성되지 않음)
 */
@Entity
@Table(name = "orders", uniqueConstraints = {
    @UniqueConstraint(name = "uk_orders_user_checkout_key", columnNames = {"user_id", "checkout_key"})
}, indexes = {
    @Index(name = "idx_orders_user_created", columnList = "user_id, created_at")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Order {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_id")
    private Long orderId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private Long userId;

    @Column(name = "order_status", nullable = false)
    @Enumerated(EnumType.STRING)
    private OrderStatus orderStatus;

    @Column(name = "payment_status", nullable = false)
    @Enumerated(EnumType.STRING)
    private PaymentStatus paymentStatus;

    @Column(name = "payment_method", nullable = false, updatable = false, length = OrderConstants.PAYMENT_METHOD_MAX_LENGTH)
    private String paymentMethod;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal totalAmount;

    @Embedded
    private ShippingAddress shippingAddress;

    @Column(name = "note", length = OrderConstants.NOTE_COLUMN_LENGTH, updatable = false)
    private String note;

    @Column(name = "checkout_key", length = OrderConstants.MAX_CHECKOUT_KEY_LENGTH, updatable = false)
    private String checkoutKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 주문 항목 관계
     * cascade = PERSIST: 주문 생성 시 OrderItem도 함께 저장
     */
    @OneToMany(cascade = CascadeType.PERSIST, fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false, updatable = false)
    @OrderBy("orderItemId ASC")
    @Builder.Default
    private List<OrderItem> orderItems = new ArrayList<>();

    /**
     * 주문 생성 팩토리 메서드
     *
     * 항목 스냅샷으로부터 총액을 계산하고 PENDING / PENDING 상태로 생성한다.
     *
     * @param userId 주문자
     * @param items 장바구니에서 스냅샷한 주문 항목 (1개 이상)
     * @param shippingAddress 배송지
     * @param paymentMethod 결제 수단
     * @param note 주문 메모 (nullable)
     * @param checkoutKey 멱등성 키 (nullable)
     */
    public static Order place(Long userId, List<OrderItem> items, ShippingAddress shippingAddress,
                              String paymentMethod, String note, String checkoutKey) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("주문 항목은 최소 1개 이상이어야 합니다");
        }

        BigDecimal totalAmount = items.stream()
                .map(OrderItem::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        LocalDateTime now = LocalDateTime.now();
        return Order.builder()
                .userId(userId)
                .orderStatus(OrderStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .paymentMethod(paymentMethod)
                .totalAmount(totalAmount)
                .shippingAddress(shippingAddress)
                .note(note)
                .checkoutKey(checkoutKey)
                .createdAt(now)
                .updatedAt(now)
                .orderItems(new ArrayList<>(items))
                .build();
    }

    /**
     * 주문 상태 전환
     * 다섯 가지 상태 사이의 전환 순서는 제한하지 않는다 (운영자가 임의 상태로 정정 가능).
     */
    public void changeStatus(OrderStatus newStatus) {
        this.orderStatus = newStatus;
        this.updatedAt = LocalDateTime.now();
    }

    public void changePaymentStatus(PaymentStatus newPaymentStatus) {
        this.paymentStatus = newPaymentStatus;
        this.updatedAt = LocalDateTime.now();
    }

    public List<OrderItem> getOrderItems() {
        return Collections.unmodifiableList(orderItems);
    }

    public int getTotalQuantity() {
        return orderItems.stream()
                .mapToInt(OrderItem::getQuantity)
                .sum();
    }
}
