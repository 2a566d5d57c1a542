package com.storefront.commerce.domain.notification.event;

import com.storefront.commerce.domain.notification.Notification;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 알림 저장 완료 이벤트
 *
 * 알림 행이 커밋된 뒤(AFTER_COMMIT) 푸시 발송 리스너가 수신한다.
 */
@Getter
@AllArgsConstructor
public class NotificationRecordedEvent {
    private final Long notificationId;
    private final Long userId;
    private final String title;
    private final String message;
    private final String type;
    private final Map<String, String> data;

    public static NotificationRecordedEvent from(Notification notification) {
        return new NotificationRecordedEvent(
                notification.getNotificationId(),
                notification.getUserId(),
                notification.getTitle(),
                notification.getMessage(),
                notification.getType().getValue(),
                new LinkedHashMap<>(notification.getData())
        );
    }
}
