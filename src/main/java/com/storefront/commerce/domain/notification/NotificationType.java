package com.storefront.commerce.domain.notification;

import lombok.Getter;

/**
 * 알림 유형 (기본값 OTHER)
 */
@Getter
public enum NotificationType {
    ORDER("order"),
    PROMOTION("promotion"),
    SYSTEM("system"),
    OTHER("other");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    /**
     * @throws InvalidNotificationTypeException 네 가지 유형 중 어느 것도 아닌 경우
     */
    public static NotificationType fromString(String type) {
        if (type == null || type.isBlank()) {
            throw new InvalidNotificationTypeException(type);
        }
        for (NotificationType candidate : values()) {
            if (candidate.value.equalsIgnoreCase(type.trim())) {
                return candidate;
            }
        }
        throw new InvalidNotificationTypeException(type);
    }
}
