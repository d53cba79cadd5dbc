package com.example.clocktower.global.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.retry.support.RetryTemplate;

/**
 * Spring Retry 설정
 *
 * - decisionRetryTemplate: 형식 오류, 존재하지 않는 이름, 제공자 호출 실패 시 같은 플레이어에게 다시 요청.
 *   재시도 간 대기 없음 (엔진은 단일 스레드, 턴 기반)
 * - @Retryable 활성화: Gemini 호출의 일시적인 네트워크 오류 재시도
 */
@Configuration
@EnableRetry
public class RetryConfig {

    @Bean
    public RetryTemplate decisionRetryTemplate(GameProperties gameProperties) {
        return RetryTemplate.builder()
                .maxAttempts(gameProperties.getDecision().getMaxAttempts())
                .retryOn(RuntimeException.class)
                .noBackoff()
                .build();
    }
}
