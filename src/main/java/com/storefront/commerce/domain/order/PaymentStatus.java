package com.storefront.commerce.domain.order;

import lombok.Getter;

/**
 * PaymentStatus - 결제 상태 (저장만 하는 필드, 실제 결제 연동 없음)
 */
@Getter
public enum PaymentStatus {
    PENDING("pending"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    PaymentStatus(String value) {
        this.value = value;
    }

    /**
     * @throws InvalidPaymentStatusException 세 가지 상태 중 어느 것도 아닌 경우
     */
    public static PaymentStatus fromString(String status) {
        if (status == null || status.isBlank()) {
            throw new InvalidPaymentStatusException(status);
        }
        for (PaymentStatus candidate : values()) {
            if (candidate.value.equalsIgnoreCase(status.trim())) {
                return candidate;
            }
        }
        throw new InvalidPaymentStatusException(status);
    }
}
