package com.storefront.commerce.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderListResponse {
    private List<OrderResponse> orders;
    private int page;
    private int limit;
    private long total;
    private int pages;

    @JsonProperty("status_counts")
    private Map<String, Long> statusCounts;
}
