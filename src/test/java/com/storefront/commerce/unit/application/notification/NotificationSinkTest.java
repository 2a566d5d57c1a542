package com.storefront.commerce.unit.application.notification;

import com.storefront.commerce.application.notification.NotificationSink;
import com.storefront.commerce.application.notification.PushDispatcher;
import com.storefront.commerce.application.notification.dto.PushMessage;
import com.storefront.commerce.domain.notification.Notification;
import com.storefront.commerce.domain.notification.NotificationRepository;
import com.storefront.commerce.domain.notification.NotificationType;
import com.storefront.commerce.domain.notification.event.NotificationRecordedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("NotificationSink 단위 테스트")
class NotificationSinkTest {

    private NotificationSink notificationSink;

    @Mock
    private NotificationRepository notificationRepository;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    @Mock
    private PushDispatcher pushDispatcher;

    @BeforeEach
    void setup() {
        MockitoAnnotations.openMocks(this);
        notificationSink = new NotificationSink(notificationRepository, eventPublisher, pushDispatcher);
    }

    @Test
    @DisplayName("알림 기록 - 저장 후 푸시용 이벤트 발행")
    void testRecord_PublishesEvent() {
        // Given
        when(notificationRepository.save(any(Notification.class))).thenAnswer(invocation -> {
            Notification saved = invocation.getArgument(0);
            ReflectionTestUtils.setField(saved, "notificationId", 7L);
            return saved;
        });

        // When
        Notification saved = notificationSink.record(1L, "제목", "내용", NotificationType.ORDER, Map.of("orderId", "3"));

        // Then
        assertEquals(7L, saved.getNotificationId());
        ArgumentCaptor<NotificationRecordedEvent> event = ArgumentCaptor.forClass(NotificationRecordedEvent.class);
        verify(eventPublisher).publishEvent(event.capture());
        assertEquals(7L, event.getValue().getNotificationId());
        assertEquals("order", event.getValue().getType());
        assertEquals("3", event.getValue().getData().get("orderId"));
    }

    @Test
    @DisplayName("알림 기록 - 저장 실패 시 이벤트 미발행")
    void testRecord_SaveFailed() {
        when(notificationRepository.save(any(Notification.class))).thenThrow(new IllegalStateException("db down"));

        assertThrows(IllegalStateException.class,
                () -> notificationSink.record(1L, "제목", "내용", NotificationType.ORDER, null));
        verifyNoInteractions(eventPublisher);
    }

    @Test
    @DisplayName("푸시 - 디스패처에 메시지 전달")
    void testPush() {
        notificationSink.push("token-1", "제목", "내용", Map.of("k", "v"));

        ArgumentCaptor<PushMessage> message = ArgumentCaptor.forClass(PushMessage.class);
        verify(pushDispatcher).dispatch(message.capture());
        assertEquals("token-1", message.getValue().getToken());
        assertEquals("v", message.getValue().getData().get("k"));
    }
}
