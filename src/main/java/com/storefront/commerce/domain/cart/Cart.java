package com.storefront.commerce.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Cart 도메인 엔티티
 * 사용자별 쇼핑 카트 (1:1 관계)
 *
 * total_items(라인 수)와 total_price(Σ 수량×단가)는 cart_items에서 계산되는 계산 필드이며
 * 항목이 바뀔 때마다 recalculate()로 갱신한다.
 * 주문 생성 시 이 행에 비관적 락을 걸어 같은 사용자의 동시 주문을 직렬화한다.
 */
@Entity
@Table(name = "carts", uniqueConstraints = {
    @UniqueConstraint(columnNames = "user_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Cart {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_id")
    private Long cartId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "total_items", nullable = false)
    private Integer totalItems;

    @Column(name = "total_price", nullable = false, precision = 14, scale = 2)
    private BigDecimal totalPrice;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public static Cart createFor(Long userId) {
        LocalDateTime now = LocalDateTime.now();
        return Cart.builder()
                .userId(userId)
                .totalItems(0)
                .totalPrice(BigDecimal.ZERO)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 현재 항목 기준으로 합계 재계산
     */
    public void recalculate(List<CartItem> items) {
        this.totalItems = items.size();
        this.totalPrice = items.stream()
                .map(CartItem::getSubtotal)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 합계 초기화 (주문 완료 후 장바구니 비우기)
     */
    public void reset() {
        this.totalItems = 0;
        this.totalPrice = BigDecimal.ZERO;
        this.updatedAt = LocalDateTime.now();
    }
}
