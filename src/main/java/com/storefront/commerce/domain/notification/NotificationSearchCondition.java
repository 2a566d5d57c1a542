package com.storefront.commerce.domain.notification;

import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 알림 목록 조회 조건 (null 필드는 조건 미적용)
 */
@Getter
@Builder
public class NotificationSearchCondition {
    private final boolean unreadOnly;
    private final NotificationType type;
    private final LocalDateTime startDate;
    private final LocalDateTime endDate;
}
