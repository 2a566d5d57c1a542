package com.storefront.commerce.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductResponse {
    @JsonProperty("product_id")
    private Long productId;

    private String name;

    private String description;

    private BigDecimal price;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("discount_price")
    private BigDecimal discountPrice;

    @JsonProperty("selling_price")
    private BigDecimal sellingPrice;

    private Integer stock;

    @JsonProperty("is_active")
    private boolean active;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;
}
