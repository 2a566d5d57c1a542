package com.storefront.commerce.presentation.order.request;

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
public class ShippingAddressRequest {
    private String street;
    private String city;
    private String state;

    @JsonProperty("zip_code")
    @JsonAlias("zipCode")
    private String zipCode;

    private String country;
}
