package com.storefront.commerce.presentation.notification;

import com.storefront.commerce.application.notification.NotificationService;
import com.storefront.commerce.presentation.common.RequestDates;
import com.storefront.commerce.presentation.notification.mapper.NotificationMapper;
import com.storefront.commerce.presentation.notification.response.MarkAllReadResponse;
import com.storefront.commerce.presentation.notification.response.NotificationListResponse;
import com.storefront.commerce.presentation.notification.response.NotificationResponse;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;

/**
 * NotificationController - 사용자 알림 API
 */
@RestController
@RequestMapping("/notifications")
public class NotificationController {

    private final NotificationService notificationService;
    private final NotificationMapper notificationMapper;

    public NotificationController(NotificationService notificationService,
                                  NotificationMapper notificationMapper) {
        this.notificationService = notificationService;
        this.notificationMapper = notificationMapper;
    }

    /**
     * GET /notifications?unreadOnly=&type=&startDate=&endDate=&page=&limit=
     */
    @GetMapping
    public ResponseEntity<NotificationListResponse> getNotifications(
            @RequestHeader("X-USER-ID") Long userId,
            @RequestParam(value = "unreadOnly", defaultValue = "false") boolean unreadOnly,
            @RequestParam(value = "type", required = false) String type,
            @RequestParam(value = "startDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
            @RequestParam(value = "endDate", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "limit", required = false) Integer limit) {
        var result = notificationService.getNotifications(userId, unreadOnly, type,
                RequestDates.startOfDay(startDate), RequestDates.endOfDay(endDate), page, limit);
        return ResponseEntity.ok(notificationMapper.toNotificationListResponse(result));
    }

    /**
     * PUT /notifications/read-all - 전체 읽음 처리
     */
    @PutMapping("/read-all")
    public ResponseEntity<MarkAllReadResponse> markAllAsRead(@RequestHeader("X-USER-ID") Long userId) {
        return ResponseEntity.ok(new MarkAllReadResponse(notificationService.markAllAsRead(userId)));
    }

    /**
     * PUT /notifications/{notification_id} - 읽음 처리
     */
    @PutMapping("/{notification_id}")
    public ResponseEntity<NotificationResponse> markAsRead(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("notification_id") Long notificationId) {
        var result = notificationService.markAsRead(userId, notificationId);
        return ResponseEntity.ok(notificationMapper.toNotificationResponse(result));
    }

    /**
     * DELETE /notifications/{notification_id}
     */
    @DeleteMapping("/{notification_id}")
    public ResponseEntity<Void> deleteNotification(
            @RequestHeader("X-USER-ID") Long userId,
            @PathVariable("notification_id") Long notificationId) {
        notificationService.deleteNotification(userId, notificationId);
        return ResponseEntity.noContent().build();
    }
}
