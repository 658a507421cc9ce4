package com.buzz.mileage.infrastructure.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Outbox 발행 / 토큰 보관 정리 스케줄러 활성화
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "buzz.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfig {
}
