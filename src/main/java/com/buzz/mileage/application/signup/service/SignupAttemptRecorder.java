package com.buzz.mileage.application.signup.service;

import com.buzz.mileage.application.signup.dto.SignupCommand;
import com.buzz.mileage.domain.risk.entity.SignupAttempt;
import com.buzz.mileage.domain.risk.entity.SignupAttemptStatus;
import com.buzz.mileage.domain.risk.repository.DeviceFingerprintRepository;
import com.buzz.mileage.domain.risk.repository.SignupAttemptRepository;
import com.buzz.mileage.domain.risk.vo.RiskAssessment;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 가입 시도 감사 기록
 *
 * 가입 트랜잭션이 롤백되어도 시도 기록은 남아야 하므로 모든 쓰기는 별도 트랜잭션(REQUIRES_NEW)으로 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignupAttemptRecorder {

    private final SignupAttemptRepository signupAttemptRepository;
    private final DeviceFingerprintRepository deviceFingerprintRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * 평가 직후 시도 기록
     * @return 시도 ID
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public String start(SignupCommand command, String fingerprintHash, RiskAssessment assessment, boolean blocked) {
        LocalDateTime now = LocalDateTime.now(clock);

        SignupAttempt attempt = signupAttemptRepository.save(SignupAttempt.builder()
                .email(command.email())
                .ipAddress(command.ipAddress())
                .deviceFingerprint(fingerprintHash)
                .userAgent(truncate(command.userAgent(), 512))
                .referralCode(command.referralCode())
                .status(blocked ? SignupAttemptStatus.BLOCKED : SignupAttemptStatus.PENDING)
                .riskScore(assessment.score())
                .riskFactors(toJson(assessment))
                .flagged(assessment.flagged())
                .resultReason(blocked ? "위험도 차단" : null)
                .attemptedAt(now)
                .completedAt(blocked ? now : null)
                .build());

        return attempt.getAttemptId();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void complete(String attemptId, String accountId, String referrerId, String fingerprintHash) {
        LocalDateTime now = LocalDateTime.now(clock);
        signupAttemptRepository.findById(attemptId)
                .ifPresent(attempt -> attempt.markSuccess(accountId, referrerId, now));
        deviceFingerprintRepository.increaseSuccessfulSignups(fingerprintHash);
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void fail(String attemptId, String reason) {
        LocalDateTime now = LocalDateTime.now(clock);
        signupAttemptRepository.findById(attemptId)
                .ifPresent(attempt -> attempt.markFailed(reason, now));
    }

    private String toJson(RiskAssessment assessment) {
        try {
            return objectMapper.writeValueAsString(assessment.factors());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("위험 요인 직렬화 실패", e);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
