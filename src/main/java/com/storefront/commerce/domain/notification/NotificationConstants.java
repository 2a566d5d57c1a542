package com.storefront.commerce.domain.notification;

/**
 * NotificationConstants - 알림 문구 및 data 키 상수
 */
public class NotificationConstants {

    // ========== 주문 접수 ==========

    public static final String ORDER_PLACED_TITLE = "주문이 접수되었습니다";

    /** %d: 주문 ID */
    public static final String ORDER_PLACED_MESSAGE = "주문 #%d 이(가) 정상적으로 접수되었습니다";

    public static final String ORDER_PLACED_EVENT = "order_placed";

    // ========== 주문 상태 변경 ==========

    public static final String ORDER_STATUS_TITLE = "주문 상태 변경";

    /** %d: 주문 ID, %s: 상태 표시명, %s: 상태 값 */
    public static final String ORDER_STATUS_MESSAGE = "주문 #%d 상태가 %s(%s)(으)로 변경되었습니다";

    public static final String ORDER_STATUS_EVENT = "order_status_updated";

    // ========== data 키 ==========

    public static final String DATA_ORDER_ID = "orderId";
    public static final String DATA_STATUS = "status";
    public static final String DATA_EVENT = "event";
    public static final String DATA_NOTIFICATION_ID = "notificationId";
    public static final String DATA_TYPE = "type";

    /** 알림 목록 기본 페이지 크기 */
    public static final int DEFAULT_PAGE_SIZE = 10;

    private NotificationConstants() {
        throw new AssertionError("NotificationConstants는 인스턴스화할 수 없습니다");
    }
}
