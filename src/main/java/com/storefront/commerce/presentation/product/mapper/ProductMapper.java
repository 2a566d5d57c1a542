package com.storefront.commerce.presentation.product.mapper;

import com.storefront.commerce.application.product.dto.ProductResult;
import com.storefront.commerce.presentation.product.response.ProductResponse;
import org.springframework.stereotype.Component;

/**
 * ProductMapper - Application ProductResult → Presentation ProductResponse 변환
 */
@Component
public class ProductMapper {

    public ProductResponse toProductResponse(ProductResult product) {
        return ProductResponse.builder()
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
