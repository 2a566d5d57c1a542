package com.storefront.commerce.application.notification.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 알림 목록 조회 결과
 *
 * total: 필터 조건에 맞는 알림 수
 * unreadCount: 필터와 무관한 사용자의 전체 미읽음 수
 */
@Getter
@Builder
@AllArgsConstructor
public class NotificationListResult {
    private final List<NotificationResult> notifications;
    private final int page;
    private final int limit;
    private final long total;
    private final int pages;
    private final long unreadCount;
}
