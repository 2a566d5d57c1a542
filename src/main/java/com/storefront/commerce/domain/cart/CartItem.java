package com.storefront.commerce.domain.cart;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * CartItem 도메인 엔티티
 * 쇼핑 카트의 라인 항목
 *
 * unit_price는 담는 시점의 판매가(할인가 우선)를 캡처한 값이며,
 * 주문 시 이 가격이 그대로 주문 항목 가격으로 고정된다.
 * subtotal은 unit_price * quantity로 계산되는 계산 필드
 */
@Entity
@Table(name = "cart_items", uniqueConstraints = {
    @UniqueConstraint(columnNames = {"cart_id", "product_id"})
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "cart_item_id")
    private Long cartItemId;

    @Column(name = "cart_id", nullable = false)
    private Long cartId;

    @Column(name = "product_id", nullable = false)
    private Long productId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "subtotal", nullable = false, precision = 14, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 장바구니 항목 생성
     *
     * @throws InvalidQuantityException 수량이 1 미만 또는 1000 초과
     */
    public static CartItem create(Long cartId, Long productId, int quantity, BigDecimal unitPrice) {
        validateQuantity(quantity);
        LocalDateTime now = LocalDateTime.now();
        return CartItem.builder()
                .cartId(cartId)
                .productId(productId)
                .quantity(quantity)
                .unitPrice(unitPrice)
                .subtotal(unitPrice.multiply(BigDecimal.valueOf(quantity)))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public void changeQuantity(int quantity) {
        validateQuantity(quantity);
        this.quantity = quantity;
        this.subtotal = unitPrice.multiply(BigDecimal.valueOf(quantity));
        this.updatedAt = LocalDateTime.now();
    }

    public boolean belongsTo(Long cartId) {
        return this.cartId.equals(cartId);
    }

    private static void validateQuantity(int quantity) {
        if (quantity < CartConstants.MIN_QUANTITY || quantity > CartConstants.MAX_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
    }
}
