package com.storefront.commerce.domain.order;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

/**
 * 배송지 값 객체 (orders 테이블에 임베디드)
 */
@Embeddable
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode
public class ShippingAddress {

    @Column(name = "shipping_street", nullable = false, length = OrderConstants.ADDRESS_FIELD_MAX_LENGTH)
    private String street;

    @Column(name = "shipping_city", nullable = false, length = OrderConstants.ADDRESS_FIELD_MAX_LENGTH)
    private String city;

    @Column(name = "shipping_state", nullable = false, length = OrderConstants.ADDRESS_FIELD_MAX_LENGTH)
    private String state;

    @Column(name = "shipping_zip_code", nullable = false, length = OrderConstants.ZIP_CODE_MAX_LENGTH)
    private String zipCode;

    @Column(name = "shipping_country", length = OrderConstants.ADDRESS_FIELD_MAX_LENGTH)
    private String country;
}
