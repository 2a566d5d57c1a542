package com.storefront.commerce.domain.product;

import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Product 도메인 엔티티
 *
 * 책임:
 * - 판매 가격(정가/할인가) 관리
 * - 재고 보유 여부 판단
 *
 * 핵심 비즈니스 규칙:
 * - 가격은 0 이상
 * - 할인가가 있으면 정가보다 작아야 함
 * - 재고는 0 이상 (차감은 저장소의 조건부 UPDATE로만 수행)
 * - 비활성 상품은 주문할 수 없음
 */
@Entity
@Table(name = "products")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "product_id")
    private Long productId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", length = 2000)
    private String description;

    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    @Column(name = "discount_price", precision = 12, scale = 2)
    private BigDecimal discountPrice;

    @Column(name = "stock", nullable = false)
    private Integer stock;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 상품 생성 팩토리 메서드
     *
     * @throws InvalidProductException 가격/할인가/재고 규칙 위반
     */
    public static Product create(String name, String description, BigDecimal price,
                                 BigDecimal discountPrice, int stock) {
        if (name == null || name.isBlank()) {
            throw new InvalidProductException("상품명은 필수입니다");
        }
        if (price == null || price.signum() < 0) {
            throw new InvalidProductException("가격은 0 이상이어야 합니다");
        }
        if (discountPrice != null && discountPrice.compareTo(price) >= 0) {
            throw new InvalidProductException("할인가는 정가보다 작아야 합니다");
        }
        if (discountPrice != null && discountPrice.signum() < 0) {
            throw new InvalidProductException("할인가는 0 이상이어야 합니다");
        }
        if (stock < ProductConstants.MIN_STOCK) {
            throw new InvalidProductException("재고는 0 이상이어야 합니다");
        }

        LocalDateTime now = LocalDateTime.now();
        return Product.builder()
                .name(name)
                .description(description)
                .price(price)
                .discountPrice(discountPrice)
                .stock(stock)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 실제 판매가: 할인가가 있으면 할인가, 없으면 정가
     */
    public BigDecimal getSellingPrice() {
        return discountPrice != null ? discountPrice : price;
    }

    /**
     * 요청 수량만큼 주문 가능한지 확인 (활성 상품 + 재고 충분)
     */
    public boolean canFulfill(int quantity) {
        return active && stock != null && stock >= quantity;
    }

    public void deactivate() {
        this.active = false;
        this.updatedAt = LocalDateTime.now();
    }
}
