package com.storefront.commerce.presentation.user.request;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 디바이스 토큰 등록 요청 (빈 문자열 또는 null이면 등록 해제)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceTokenRequest {
    @JsonProperty("device_token")
    @JsonAlias("deviceToken")
    private String deviceToken;
}
