package com.storefront.commerce.presentation.notification.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class MarkAllReadResponse {
    @JsonProperty("updated_count")
    private int updatedCount;
}
