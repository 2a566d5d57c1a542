package com.storefront.commerce.application.order.dto;

import com.storefront.commerce.domain.order.ShippingAddress;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 배송지 입력 (Application 계층)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingAddressCommand {
    private String street;
    private String city;
    private String state;
    private String zipCode;
    private String country;

    public ShippingAddress toShippingAddress() {
        return ShippingAddress.builder()
                .street(street.trim())
                .city(city.trim())
                .state(state.trim())
                .zipCode(zipCode.trim())
                .country(country != null && !country.isBlank() ? country.trim() : null)
                .build();
    }
}
