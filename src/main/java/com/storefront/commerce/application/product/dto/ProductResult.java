package com.storefront.commerce.application.product.dto;

import com.storefront.commerce.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 상품 조회 결과 (Application layer 내부 DTO)
 */
@Getter
@Builder
@AllArgsConstructor
public class ProductResult {
    private final Long productId;
    private final String name;
    private final String description;
    private final BigDecimal price;
    private final BigDecimal discountPrice;
    private final BigDecimal sellingPrice;
    private final Integer stock;
    private final boolean active;
    private final LocalDateTime createdAt;

    public static ProductResult from(Product product) {
        return ProductResult.builder()
                .productId(product.getProductId())
                .name(product.getName())
                .description(product.getDescription())
                .price(product.getPrice())
                .discountPrice(product.getDiscountPrice())
                .sellingPrice(product.getSellingPrice())
                .stock(product.getStock())
                .active(product.isActive())
                .createdAt(product.getCreatedAt())
                .build();
    }
}
