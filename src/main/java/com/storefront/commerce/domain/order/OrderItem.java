package com.storefront.commerce.domain.order;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * OrderItem 도메인 엔티티
 *
 * 책임:
 * - 주문 내 각 상품 항목의 정보 관리
 * - 스냅샷: 주문 시점의 상품명과 장바구니 단가를 보존
 *
 * 핵심 비즈니스 규칙:
 * - 단가는 장바구니 항목에 캡처된 가격이며 이후 카탈로그 가격 변경의 영향을 받지 않음
 * - 소계 = 단가 × 수량
 * - 생성 이후 변경 불가 (setter 없음)
 */
@Entity
@Table(name = "order_items")
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class OrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "order_item_id")
    private Long orderItemId;

    @Column(name = "product_id", nullable = false, updatable = false)
    private Long productId;

    @Column(name = "product_name", nullable = false, updatable = false)
    private String productName;

    @Column(name = "quantity", nullable = false, updatable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "subtotal", nullable = false, updatable = false, precision = 14, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 장바구니 항목으로부터 주문 항목 스냅샷 생성
     *
     * @param productId 상품 ID
     * @param productName 주문 시점의 상품명 (스냅샷)
     * @param quantity 수량
     * @param unitPrice 장바구니에 캡처된 단가
     */
    public static OrderItem snapshot(Long productId, String productName, int quantity, BigDecimal unitPrice) {
        if (quantity < OrderConstants.MIN_ORDER_QUANTITY) {
            throw new IllegalArgumentException("수량은 1 이상이어야 합니다");
        }
        if (unitPrice == null || unitPrice.signum() < 0) {
            throw new IllegalArgumentException("단가는 0 이상이어야 합니다");
        }
        if (productName == null || productName.isBlank()) {
            throw new IllegalArgumentException("상품명은 필수입니다");
        }

        return OrderItem.builder()
                .productId(productId)
                .productName(productName)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .subtotal(unitPrice.multiply(BigDecimal.valueOf(quantity)))
                .createdAt(LocalDateTime.now())
                .build();
    }
}
