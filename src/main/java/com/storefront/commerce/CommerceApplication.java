package com.storefront.commerce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;

/**
 * Storefront Commerce 애플리케이션 메인 클래스
 *
 * 활성화된 기능:
 * - @EnableAsync: 푸시 알림 비동기 발송
 * - @EnableRetry: 푸시 발송 재시도 (@Retryable / @Recover)
 * - @EnableAspectJAutoProxy: AOP Aspect 자동 프록시 생성
 */
@EnableAsync
@EnableRetry
@EnableAspectJAutoProxy
@SpringBootApplication
public class CommerceApplication {

    public static void main(String[] args) {
        SpringApplication.run(CommerceApplication.class, args);
    }

}
