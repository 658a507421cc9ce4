package com.buzz.mileage.infrastructure.outbox;

/**
 * Outbox 이벤트 상태
 */
public enum EventStatus {
    /**
     * Kafka 발행 대기
     */
    PENDING,

    PUBLISHED,

    /**
     * 최대 재시도 횟수 초과
     */
    FAILED
}
