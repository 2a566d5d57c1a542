package com.storefront.commerce.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShippingAddressResponse {
    private String street;
    private String city;
    private String state;

    @JsonProperty("zip_code")
    private String zipCode;

    private String country;
}
