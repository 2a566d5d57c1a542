package com.storefront.commerce.application.notification;

import com.storefront.commerce.application.notification.dto.PushMessage;
import com.storefront.commerce.domain.notification.Notification;
import com.storefront.commerce.domain.notification.NotificationRepository;
import com.storefront.commerce.domain.notification.NotificationType;
import com.storefront.commerce.domain.notification.event.NotificationRecordedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;

/**
 * NotificationSink - 인앱 알림 기록 및 푸시 발송 진입점
 *
 * 흐름:
 * 1. record(): 알림 행 저장 (독립 트랜잭션) + NotificationRecordedEvent 발행
 * 2. 커밋 이후 PushNotificationEventListener가 비동기로 push() 호출
 * 3. push(): PushDispatcher를 통해 재시도 포함 발송
 *
 * record()의 실패는 호출자에게 전파되며, push()의 실패는 호출자에게 전파되지 않는다.
 */
@Slf4j
@Service
public class NotificationSink {

    private final NotificationRepository notificationRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final PushDispatcher pushDispatcher;

    public NotificationSink(NotificationRepository notificationRepository,
                            ApplicationEventPublisher eventPublisher,
                            PushDispatcher pushDispatcher) {
        this.notificationRepository = notificationRepository;
        this.eventPublisher = eventPublisher;
        this.pushDispatcher = pushDispatcher;
    }

    /**
     * 알림 기록
     *
     * @return 저장된 알림
     */
    @Transactional(rollbackFor = Exception.class)
    public Notification record(Long userId, String title, String message,
                               NotificationType type, Map<String, String> data) {
        Notification saved = notificationRepository.save(
                Notification.create(userId, title, message, type, data));

        eventPublisher.publishEvent(NotificationRecordedEvent.from(saved));

        log.info("[NotificationSink] 알림 저장 - notificationId={}, userId={}, type={}",
                saved.getNotificationId(), userId, saved.getType().getValue());
        return saved;
    }

    /**
     * 단일 디바이스 토큰으로 푸시 발송 (best-effort)
     */
    public void push(String token, String title, String body, Map<String, String> data) {
        pushDispatcher.dispatch(new PushMessage(token, title, body, data));
    }
}
