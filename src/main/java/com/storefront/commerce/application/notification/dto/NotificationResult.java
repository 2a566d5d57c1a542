package com.storefront.commerce.application.notification.dto;

import com.storefront.commerce.domain.notification.Notification;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Builder
@AllArgsConstructor
public class NotificationResult {
    private final Long notificationId;
    private final Long userId;
    private final String title;
    private final String message;
    private final String type;
    private final boolean read;
    private final Map<String, String> data;
    private final LocalDateTime createdAt;
    private final LocalDateTime updatedAt;

    public static NotificationResult from(Notification notification) {
        return NotificationResult.builder()
                .notificationId(notification.getNotificationId())
                .userId(notification.getUserId())
                .title(notification.getTitle())
                .message(notification.getMessage())
                .type(notification.getType().getValue())
                .read(notification.isRead())
                .data(new LinkedHashMap<>(notification.getData()))
                .createdAt(notification.getCreatedAt())
                .updatedAt(notification.getUpdatedAt())
                .build();
    }
}
