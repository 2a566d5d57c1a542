package com.storefront.commerce.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 결제 상태 변경 요청 (pending, completed, failed)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class UpdatePaymentStatusRequest {
    @JsonProperty("payment_status")
    @JsonAlias("paymentStatus")
    private String paymentStatus;
}
