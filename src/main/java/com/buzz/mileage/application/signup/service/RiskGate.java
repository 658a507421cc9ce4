package com.buzz.mileage.application.signup.service;

import com.buzz.mileage.application.signup.dto.RiskDecision;
import com.buzz.mileage.application.signup.dto.SignupCommand;
import com.buzz.mileage.common.config.RiskProperties;
import com.buzz.mileage.domain.risk.entity.DeviceFingerprint;
import com.buzz.mileage.domain.risk.exception.SignupBlockedException;
import com.buzz.mileage.domain.risk.repository.DeviceFingerprintRepository;
import com.buzz.mileage.domain.risk.service.DeviceFingerprintHasher;
import com.buzz.mileage.domain.risk.service.IpReputationChecker;
import com.buzz.mileage.domain.risk.service.RiskScorer;
import com.buzz.mileage.domain.risk.service.SignupAttemptCounter;
import com.buzz.mileage.domain.risk.vo.IpReputation;
import com.buzz.mileage.domain.risk.vo.RiskAssessment;
import com.buzz.mileage.domain.risk.vo.RiskSignals;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * 가입 위험도 게이트
 *
 * 1. 신뢰 IP 는 점수 계산 생략
 * 2. 저장소에서 신호 수집 (IP 시도 수, 기기 지문, IP 평판) → RiskScorer 로 점수 계산
 * 3. 감사 기록 저장 후 임계값 이상이면 SignupBlockedException
 *
 * 기기 지문 집계와 IP 카운터 기록은 다음 평가용 부가 기록이라 실패해도 가입을 막지 않는다.
 * 신호 수집 중 저장소 장애가 나면 차단하지 않고 SCORER_UNAVAILABLE 로 표시한 뒤 통과시킨다 (fail-open).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RiskGate {

    private final RiskScorer riskScorer;
    private final RiskProperties riskProperties;
    private final SignupAttemptCounter signupAttemptCounter;
    private final IpReputationChecker ipReputationChecker;
    private final DeviceFingerprintRepository deviceFingerprintRepository;
    private final SignupAttemptRecorder signupAttemptRecorder;
    private final DeviceFingerprintTracker deviceFingerprintTracker;

    /**
     * @throws SignupBlockedException 점수가 차단 임계값 이상 (감사 기록은 이미 저장됨)
     */
    public RiskDecision assess(SignupCommand command) {
        String fingerprint = DeviceFingerprintHasher.hash(command.userAgent(), command.clientFingerprint());
        RiskAssessment assessment = evaluate(command, fingerprint);

        int threshold = riskProperties.getBlockThreshold();
        boolean blocked = assessment.score() >= threshold;

        String attemptId = signupAttemptRecorder.start(command, fingerprint, assessment, blocked);
        recordAttempt(command.ipAddress(), attemptId);
        trackDevice(command, fingerprint);

        if (blocked) {
            log.warn("가입 차단 - email={}, ip={}, score={}, factors={}",
                    command.email(), command.ipAddress(), assessment.score(), assessment.factors());
            throw new SignupBlockedException(assessment.score(), threshold);
        }

        if (assessment.flagged()) {
            log.info("가입 위험 신호 감지 (통과) - email={}, score={}, flags={}",
                    command.email(), assessment.score(), assessment.flags());
        }
        return new RiskDecision(attemptId, fingerprint, assessment);
    }

    private RiskAssessment evaluate(SignupCommand command, String fingerprint) {
        String ipAddress = command.ipAddress();
        if (ipAddress != null && riskProperties.getTrustedIps().contains(ipAddress)) {
            return RiskAssessment.trusted();
        }

        try {
            return riskScorer.score(collectSignals(command, fingerprint));
        } catch (RuntimeException e) {
            log.warn("위험도 신호 수집 실패 - fail-open 처리. email={}, ip={}", command.email(), ipAddress, e);
            return RiskAssessment.unavailable(e.getClass().getSimpleName());
        }
    }

    private RiskSignals collectSignals(SignupCommand command, String fingerprint) {
        String ipAddress = command.ipAddress();

        long recentIpAttempts = ipAddress == null
                ? 0L
                : signupAttemptCounter.countRecent(ipAddress, riskProperties.getAttemptWindow());
        IpReputation reputation = ipReputationChecker.check(ipAddress);
        Optional<DeviceFingerprint> device = deviceFingerprintRepository.findByFingerprintHash(fingerprint);

        return new RiskSignals(
                command.userAgent(),
                reputation,
                recentIpAttempts,
                device.map(DeviceFingerprint::isBlocked).orElse(false),
                device.map(DeviceFingerprint::getSignupAttempts).orElse(0));
    }

    /**
     * 카운터 기록 실패는 다음 평가의 정확도만 떨어뜨리므로 가입을 막지 않는다
     */
    private void recordAttempt(String ipAddress, String attemptId) {
        if (ipAddress == null) {
            return;
        }
        try {
            signupAttemptCounter.record(ipAddress, attemptId, riskProperties.getAttemptWindow());
        } catch (RuntimeException e) {
            log.warn("가입 시도 카운터 기록 실패 - ip={}, attemptId={}", ipAddress, attemptId, e);
        }
    }

    private void trackDevice(SignupCommand command, String fingerprint) {
        try {
            deviceFingerprintTracker.recordAttempt(fingerprint, command.ipAddress(), command.userAgent());
        } catch (DataIntegrityViolationException e) {
            log.debug("기기 지문 동시 등록 - 갱신 재시도. fingerprint={}", fingerprint);
            retryTrackDevice(command, fingerprint);
        } catch (RuntimeException e) {
            log.warn("기기 지문 집계 실패 - fingerprint={}, email={}", fingerprint, command.email(), e);
        }
    }

    private void retryTrackDevice(SignupCommand command, String fingerprint) {
        try {
            deviceFingerprintTracker.recordAttempt(fingerprint, command.ipAddress(), command.userAgent());
        } catch (RuntimeException e) {
            log.warn("기기 지문 집계 재시도 실패 - fingerprint={}, email={}", fingerprint, command.email(), e);
        }
    }
}
