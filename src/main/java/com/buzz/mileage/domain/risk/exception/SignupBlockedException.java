package com.buzz.mileage.domain.risk.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

/**
 * 위험도 점수가 차단 기준 이상인 가입 시도
 */
public class SignupBlockedException extends BusinessException {

    private final int riskScore;

    public SignupBlockedException(int riskScore, int threshold) {
        super(ErrorCode.K001, String.format("보안 정책에 의해 가입이 차단되었습니다. score: %d, threshold: %d", riskScore, threshold));
        this.riskScore = riskScore;
    }

    public int getRiskScore() {
        return riskScore;
    }
}
