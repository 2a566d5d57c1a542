package com.storefront.commerce.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Map;

/**
 * 주문 목록 조회 결과
 *
 * statusCounts: 필터와 무관하게 사용자의 전체 주문을 상태별로 집계 (없는 상태는 0)
 */
@Getter
@Builder
@AllArgsConstructor
public class OrderListResult {
    private final List<OrderResult> orders;
    private final int page;
    private final int limit;
    private final long total;
    private final int pages;
    private final Map<String, Long> statusCounts;
}
