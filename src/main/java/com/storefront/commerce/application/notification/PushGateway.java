package com.storefront.commerce.application.notification;

import com.storefront.commerce.application.notification.dto.PushMessage;

/**
 * PushGateway - 외부 푸시 제공자 포트
 *
 * 구현체는 기동 시 설정(commerce.push.*)에 따라 하나만 등록된다.
 * - HttpPushGateway: 실제 HTTP 발송
 * - DisabledPushGateway: 자격 증명이 없을 때 로그만 남김
 */
public interface PushGateway {

    /**
     * @throws PushDeliveryException 제공자 호출 실패 (재시도 대상)
     */
    void send(PushMessage message);
}
