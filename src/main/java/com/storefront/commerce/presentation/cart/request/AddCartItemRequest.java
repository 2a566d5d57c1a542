package com.storefront.commerce.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemRequest {
    @JsonProperty("product_id")
    @JsonAlias("productId")
    private Long productId;

    private Integer quantity;
}
