package com.storefront.commerce.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 요청 DTO
 *
 * 주문 항목은 받지 않는다. 요청자의 장바구니 전체가 주문으로 전환된다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderRequest {
    @JsonProperty("shipping_address")
    @JsonAlias("shippingAddress")
    private ShippingAddressRequest shippingAddress;

    @JsonProperty("payment_method")
    @JsonAlias("paymentMethod")
    private String paymentMethod;

    private String note;
}
