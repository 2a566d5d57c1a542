package com.storefront.commerce.application.order;

import com.storefront.commerce.application.notification.NotificationSink;
import com.storefront.commerce.application.order.dto.OrderListResult;
import com.storefront.commerce.application.order.dto.OrderPlacement;
import com.storefront.commerce.application.order.dto.OrderResult;
import com.storefront.commerce.application.order.dto.PlaceOrderCommand;
import com.storefront.commerce.application.order.dto.PlaceOrderResult;
import com.storefront.commerce.common.exception.ApplicationException;
import com.storefront.commerce.common.exception.ErrorCode;
import com.storefront.commerce.common.exception.InvalidRequestException;
import com.storefront.commerce.domain.notification.NotificationConstants;
import com.storefront.commerce.domain.notification.NotificationType;
import com.storefront.commerce.domain.order.OrderConstants;
import com.storefront.commerce.domain.order.OrderNotFoundException;
import com.storefront.commerce.domain.order.OrderRepository;
import com.storefront.commerce.domain.order.OrderSearchCondition;
import com.storefront.commerce.domain.order.OrderStatus;
import com.storefront.commerce.domain.order.PaymentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * OrderService - Application 계층 주문 유스케이스
 *
 * 주문 생성 3단계 프로세스:
 * 1단계: 검증 (OrderValidator, 부수 효과 없음)
 * 2단계: 원자적 거래 (OrderTransactionService, 단일 트랜잭션)
 *        - 장바구니 락 → 재고 확인 → 조건부 재고 차감 → 주문 저장 → 장바구니 비우기
 * 3단계: 커밋 이후 알림 기록 (NotificationSink, 독립 트랜잭션)
 *        - 실패해도 주문은 유지, RECONCILE 로그 + notificationRecorded=false
 *        - 푸시 발송은 알림 커밋 이후 비동기로 진행
 */
@Service
public class OrderService {

    private static final Logger log = LoggerFactory.getLogger(OrderService.class);

    private static final int MAX_PAGE_SIZE = 100;

    private final OrderRepository orderRepository;
    private final OrderValidator orderValidator;
    private final OrderTransactionService orderTransactionService;
    private final NotificationSink notificationSink;

    public OrderService(OrderRepository orderRepository,
                        OrderValidator orderValidator,
                        OrderTransactionService orderTransactionService,
                        NotificationSink notificationSink) {
        this.orderRepository = orderRepository;
        this.orderValidator = orderValidator;
        this.orderTransactionService = orderTransactionService;
        this.notificationSink = notificationSink;
    }

    /**
     * 장바구니 → 주문 생성
     *
     * @param userId 주문자 (X-USER-ID)
     * @param command 배송지, 결제 수단, 메모, 멱등성 키
     * @return 생성된 주문과 알림 기록 여부
     * @throws com.storefront.commerce.common.exception.InvalidRequestException 요청 값 검증 실패
     * @throws com.storefront.commerce.domain.cart.EmptyCartException 장바구니가 비어 있음
     * @throws com.storefront.commerce.domain.product.InsufficientStockException 재고 부족
     * @throws com.storefront.commerce.domain.product.ProductNotFoundException 장바구니 상품이 삭제됨
     */
    public PlaceOrderResult placeOrder(Long userId, PlaceOrderCommand command) {
        // ===== 1단계: 검증 =====
        orderValidator.validatePlaceOrder(command);

        // ===== 2단계: 원자적 거래 =====
        OrderPlacement placement;
        try {
            placement = orderTransactionService.executeTransactionalOrder(userId, command);
        } catch (DataIntegrityViolationException e) {
            placement = resolveDuplicateCheckout(userId, command, e);
        }

        if (placement.isReplayed()) {
            return PlaceOrderResult.replayed(placement.getOrder());
        }

        // ===== 3단계: 알림 기록 (best-effort) =====
        OrderResult order = placement.getOrder();
        boolean recorded = recordOrderNotification(
                order.getUserId(),
                order.getOrderId(),
                NotificationConstants.ORDER_PLACED_TITLE,
                String.format(NotificationConstants.ORDER_PLACED_MESSAGE, order.getOrderId()),
                orderPlacedData(order.getOrderId()));

        return PlaceOrderResult.created(order, recorded);
    }

    /**
     * 주문 상세 조회
     *
     * @throws OrderNotFoundException 주문이 없거나 요청자 소유가 아님
     */
    @Transactional(readOnly = true)
    public OrderResult getOrder(Long userId, Long orderId) {
        return orderRepository.findByIdAndUserId(orderId, userId)
                .map(OrderResult::from)
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }

    /**
     * 주문 목록 조회 (최신순)
     *
     * statusCounts는 필터와 무관하게 사용자의 전체 주문 기준으로 집계한다.
     *
     * @param statusRaw null이면 전체 상태
     * @param page 1부터 시작 (null이면 1)
     * @param limit null이면 10
     */
    @Transactional(readOnly = true)
    public OrderListResult getOrders(Long userId, String statusRaw,
                                     LocalDateTime startDate, LocalDateTime endDate,
                                     Integer page, Integer limit) {
        int pageNumber = page != null ? page : 1;
        int pageSize = limit != null ? limit : OrderConstants.DEFAULT_PAGE_SIZE;
        if (pageNumber < 1) {
            throw new InvalidRequestException("page는 1 이상이어야 합니다");
        }
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new InvalidRequestException("limit는 1 이상 " + MAX_PAGE_SIZE + " 이하여야 합니다");
        }

        OrderSearchCondition condition = OrderSearchCondition.builder()
                .status(statusRaw == null || statusRaw.isBlank() ? null : OrderStatus.fromString(statusRaw))
                .startDate(startDate)
                .endDate(endDate)
                .build();

        List<OrderResult> orders = orderRepository.findByUserId(userId, condition, pageNumber - 1, pageSize)
                .stream()
                .map(OrderResult::from)
                .collect(Collectors.toList());
        long total = orderRepository.countByUserId(userId, condition);

        Map<OrderStatus, Long> counted = orderRepository.countByStatus(userId);
        Map<String, Long> statusCounts = new LinkedHashMap<>();
        for (OrderStatus status : OrderStatus.values()) {
            statusCounts.put(status.getValue(), counted.getOrDefault(status, 0L));
        }

        return OrderListResult.builder()
                .orders(orders)
                .page(pageNumber)
                .limit(pageSize)
                .total(total)
                .pages((int) Math.ceil((double) total / pageSize))
                .statusCounts(statusCounts)
                .build();
    }

    /**
     * 주문 상태 변경 (소유자만)
     *
     * @throws com.storefront.commerce.domain.order.InvalidOrderStatusException 상태 값이 유효하지 않음
     * @throws OrderNotFoundException 주문이 없거나 요청자 소유가 아님
     */
    public OrderResult updateStatus(Long orderId, Long requesterId, String statusRaw) {
        OrderStatus newStatus = OrderStatus.fromString(statusRaw);
        OrderResult order = orderTransactionService.changeStatus(orderId, requesterId, newStatus);
        notifyStatusChanged(order, newStatus);
        return order;
    }

    /**
     * 관리자 주문 상태 변경 (소유권 검사 없음)
     */
    public OrderResult updateStatusAsAdmin(Long orderId, String statusRaw) {
        OrderStatus newStatus = OrderStatus.fromString(statusRaw);
        OrderResult order = orderTransactionService.changeStatus(orderId, null, newStatus);
        notifyStatusChanged(order, newStatus);
        return order;
    }

    /**
     * 결제 상태 변경 (알림 없음)
     *
     * @throws com.storefront.commerce.domain.order.InvalidPaymentStatusException 결제 상태 값이 유효하지 않음
     */
    public OrderResult updatePaymentStatus(Long orderId, String paymentStatusRaw) {
        PaymentStatus newPaymentStatus = PaymentStatus.fromString(paymentStatusRaw);
        return orderTransactionService.changePaymentStatus(orderId, newPaymentStatus);
    }

    /**
     * 같은 멱등성 키의 동시 요청이 고유 제약조건에서 충돌한 경우 선행 주문을 반환한다.
     */
    private OrderPlacement resolveDuplicateCheckout(Long userId, PlaceOrderCommand command,
                                                    DataIntegrityViolationException e) {
        if (command.hasCheckoutKey()) {
            Optional<OrderResult> existing = orderTransactionService.findPlacedOrder(userId, command.getCheckoutKey());
            if (existing.isPresent()) {
                log.info("[OrderService] 멱등성 키 충돌 - 기존 주문 반환: userId={}, orderId={}",
                        userId, existing.get().getOrderId());
                return OrderPlacement.replayed(existing.get());
            }
        }
        log.error("[OrderService] 주문 저장 중 제약조건 위반 - userId={}, error={}", userId, e.getMessage(), e);
        throw new ApplicationException(ErrorCode.ORDER_CREATION_FAILED, e);
    }

    private void notifyStatusChanged(OrderResult order, OrderStatus newStatus) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put(NotificationConstants.DATA_ORDER_ID, String.valueOf(order.getOrderId()));
        data.put(NotificationConstants.DATA_STATUS, newStatus.getValue());
        data.put(NotificationConstants.DATA_EVENT, NotificationConstants.ORDER_STATUS_EVENT);

        recordOrderNotification(
                order.getUserId(),
                order.getOrderId(),
                NotificationConstants.ORDER_STATUS_TITLE,
                String.format(NotificationConstants.ORDER_STATUS_MESSAGE,
                        order.getOrderId(), newStatus.getDisplayName(), newStatus.getValue()),
                data);
    }

    private Map<String, String> orderPlacedData(Long orderId) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put(NotificationConstants.DATA_ORDER_ID, String.valueOf(orderId));
        data.put(NotificationConstants.DATA_EVENT, NotificationConstants.ORDER_PLACED_EVENT);
        return data;
    }

    /**
     * 주문 알림 기록 (커밋된 주문에 대해 호출)
     *
     * @return 기록 성공 여부
     */
    private boolean recordOrderNotification(Long userId, Long orderId, String title, String message,
                                            Map<String, String> data) {
        try {
            notificationSink.record(userId, title, message, NotificationType.ORDER, data);
            return true;
        } catch (Exception e) {
            log.error("[OrderService] RECONCILE 주문 알림 기록 실패 - orderId={}, userId={}, title={}, error={}",
                    orderId, userId, title, e.getMessage(), e);
            return false;
        }
    }
}
