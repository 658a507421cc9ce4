package com.buzz.mileage.domain.risk.service;

import java.time.Duration;

/**
 * IP 별 가입 시도 카운터
 * 여러 인스턴스가 공유해야 하므로 저장소 기반으로 구현한다
 */
public interface SignupAttemptCounter {

    /**
     * window 안에 기록된 시도 수
     */
    long countRecent(String ipAddress, Duration window);

    void record(String ipAddress, String attemptId, Duration window);
}
