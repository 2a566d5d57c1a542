package com.storefront.commerce.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * 통일된 에러 응답 DTO
 *
 * {
 *   "error_code": "DOMAIN_PRODUCT_INSUFFICIENT_STOCK",
 *   "error_message": "재고가 부족합니다 | 상품: 머그컵, 요청: 3, 재고: 1",
 *   "timestamp": "2025-11-07T12:34:56.789Z",
 *   "request_id": "req-abc123def456"
 * }
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorResponse {
    @JsonProperty("error_code")
    private String errorCode;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("timestamp")
    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'", timezone = "UTC")
    private Instant timestamp;

    @JsonProperty("request_id")
    private String requestId;

    public static ErrorResponse of(String errorCode, String errorMessage) {
        return ErrorResponse.builder()
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .timestamp(Instant.now())
                .requestId("req-" + UUID.randomUUID().toString().substring(0, 12))
                .build();
    }
}
