package com.buzz.mileage.application.signup.service;

import com.buzz.mileage.domain.risk.entity.DeviceFingerprint;
import com.buzz.mileage.domain.risk.repository.DeviceFingerprintRepository;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 기기 지문별 가입 시도 집계
 *
 * 기존 기기는 조건부 UPDATE 로 횟수를 올리고, 없으면 새로 저장한다.
 * 같은 새 기기로 동시에 들어오면 한쪽 INSERT 가 uk_device_fingerprints_hash 에 걸리므로
 * 호출 측(RiskGate)이 DataIntegrityViolationException 을 받아 한 번 더 호출한다.
 */
@Service
@RequiredArgsConstructor
public class DeviceFingerprintTracker {

    private static final int USER_AGENT_MAX_LENGTH = 512;

    private final DeviceFingerprintRepository deviceFingerprintRepository;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void recordAttempt(String fingerprintHash, String ipAddress, String userAgent) {
        LocalDateTime now = LocalDateTime.now(clock);
        int updated = deviceFingerprintRepository.increaseSignupAttempts(fingerprintHash, ipAddress, now);
        if (updated == 0) {
            deviceFingerprintRepository.saveAndFlush(
                    DeviceFingerprint.firstSeen(fingerprintHash, ipAddress, truncate(userAgent), now));
        }
    }

    private static String truncate(String userAgent) {
        if (userAgent == null || userAgent.length() <= USER_AGENT_MAX_LENGTH) {
            return userAgent;
        }
        return userAgent.substring(0, USER_AGENT_MAX_LENGTH);
    }
}
