package com.storefront.commerce.presentation.user.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class DeviceTokenResponse {
    @JsonProperty("user_id")
    private Long userId;

    @JsonProperty("push_enabled")
    private boolean pushEnabled;
}
