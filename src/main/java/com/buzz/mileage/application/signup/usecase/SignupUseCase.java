package com.buzz.mileage.application.signup.usecase;

import com.buzz.mileage.application.signup.dto.RiskDecision;
import com.buzz.mileage.application.signup.dto.SignupCommand;
import com.buzz.mileage.application.signup.dto.SignupResponse;
import com.buzz.mileage.application.signup.dto.SignupResult;
import com.buzz.mileage.application.signup.service.RiskGate;
import com.buzz.mileage.application.signup.service.SignupAttemptRecorder;
import com.buzz.mileage.application.signup.service.SignupService;
import com.buzz.mileage.infrastructure.aop.annotation.DistributedLock;
import com.buzz.mileage.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 회원 가입 유스케이스 (추천 가입 포함)
 *
 * 위험도 게이트 → 가입 트랜잭션 → 시도 기록 갱신
 * 같은 이메일의 동시 가입은 분산 락(lock:signup:{email})으로 직렬화하고, 유니크 제약이 최종 방어선이다.
 * 위험도 게이트와 마찬가지로 Redis 장애 시 락 없이 진행한다 (failOpen).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignupUseCase {

    private final RiskGate riskGate;
    private final SignupService signupService;
    private final SignupAttemptRecorder signupAttemptRecorder;

    @Trace
    @DistributedLock(key = "'signup:'.concat(#command.email())", failOpen = true)
    public SignupResponse execute(SignupCommand command) {
        RiskDecision decision = riskGate.assess(command);

        SignupResult result;
        try {
            result = signupService.signup(command);
        } catch (RuntimeException e) {
            signupAttemptRecorder.fail(decision.attemptId(), e.getMessage());
            throw e;
        }

        try {
            signupAttemptRecorder.complete(decision.attemptId(), result.accountId(), result.referrerId(),
                    decision.deviceFingerprint());
        } catch (RuntimeException e) {
            log.warn("가입 시도 완료 기록 실패 (가입은 완료됨) - attemptId={}, accountId={}",
                    decision.attemptId(), result.accountId(), e);
        }
        return SignupResponse.from(result, decision);
    }
}
