package com.storefront.commerce.application.notification.listener;

import com.storefront.commerce.application.notification.NotificationSink;
import com.storefront.commerce.domain.notification.NotificationConstants;
import com.storefront.commerce.domain.notification.event.NotificationRecordedEvent;
import com.storefront.commerce.domain.user.User;
import com.storefront.commerce.domain.user.UserRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * PushNotificationEventListener - 알림 저장 커밋 이후 푸시 발송
 *
 * 역할:
 * - 알림 행이 커밋된 뒤(AFTER_COMMIT) 별도 스레드에서 푸시 발송
 * - 디바이스 토큰이 없는 사용자는 건너뜀
 * - 발송 실패는 주문/상태 변경 응답에 영향을 주지 않음
 */
@Slf4j
@Component
public class PushNotificationEventListener {

    private final UserRepository userRepository;
    private final NotificationSink notificationSink;

    public PushNotificationEventListener(UserRepository userRepository,
                                         NotificationSink notificationSink) {
        this.userRepository = userRepository;
        this.notificationSink = notificationSink;
    }

    @Async
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void handleNotificationRecorded(NotificationRecordedEvent event) {
        try {
            Optional<User> user = userRepository.findById(event.getUserId());
            if (user.isEmpty() || !user.get().hasDeviceToken()) {
                log.debug("[PushNotificationEventListener] 디바이스 토큰 없음, 푸시 생략 - userId={}, notificationId={}",
                        event.getUserId(), event.getNotificationId());
                return;
            }

            Map<String, String> data = new LinkedHashMap<>(event.getData());
            data.put(NotificationConstants.DATA_NOTIFICATION_ID, String.valueOf(event.getNotificationId()));
            data.put(NotificationConstants.DATA_TYPE, event.getType());

            notificationSink.push(user.get().getDeviceToken(), event.getTitle(), event.getMessage(), data);
        } catch (Exception e) {
            log.error("[PushNotificationEventListener] RECONCILE 푸시 처리 실패 - notificationId={}, userId={}, error={}",
                    event.getNotificationId(), event.getUserId(), e.getMessage(), e);
        }
    }
}
