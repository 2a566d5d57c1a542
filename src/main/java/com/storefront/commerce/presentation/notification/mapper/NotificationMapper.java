package com.storefront.commerce.presentation.notification.mapper;

import com.storefront.commerce.application.notification.dto.NotificationListResult;
import com.storefront.commerce.application.notification.dto.NotificationResult;
import com.storefront.commerce.presentation.notification.response.NotificationListResponse;
import com.storefront.commerce.presentation.notification.response.NotificationResponse;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

@Component
public class NotificationMapper {

    public NotificationResponse toNotificationResponse(NotificationResult notification) {
        return NotificationResponse.builder()
                .notificationId(notification.getNotificationId())
                .userId(notification.getUserId())
                .title(notification.getTitle())
                .message(notification.getMessage())
                .type(notification.getType())
                .read(notification.isRead())
                .data(notification.getData())
                .createdAt(notification.getCreatedAt())
                .updatedAt(notification.getUpdatedAt())
                .build();
    }

    public NotificationListResponse toNotificationListResponse(NotificationListResult result) {
        return NotificationListResponse.builder()
                .notifications(result.getNotifications().stream()
                        .map(this::toNotificationResponse)
                        .collect(Collectors.toList()))
                .page(result.getPage())
                .limit(result.getLimit())
                .total(result.getTotal())
                .pages(result.getPages())
                .unreadCount(result.getUnreadCount())
                .build();
    }
}
