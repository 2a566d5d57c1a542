package com.storefront.commerce.infrastructure.external.push;

import com.storefront.commerce.application.notification.PushGateway;
import com.storefront.commerce.application.notification.dto.PushMessage;
import lombok.extern.slf4j.Slf4j;

/**
 * DisabledPushGateway - 푸시 비활성화 상태의 게이트웨이
 *
 * 자격 증명이 없거나 commerce.push.enabled=false 인 환경(로컬, 테스트)에서 사용한다.
 * 인앱 알림 행은 그대로 저장되고 푸시만 생략된다.
 */
@Slf4j
public class DisabledPushGateway implements PushGateway {

    @Override
    public void send(PushMessage message) {
        log.info("[DisabledPushGateway] 푸시 비활성화 - 발송 생략: title={}, data={}",
                message.getTitle(), message.getData());
    }
}
