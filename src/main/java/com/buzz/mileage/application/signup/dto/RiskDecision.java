package com.buzz.mileage.application.signup.dto;

import com.buzz.mileage.domain.risk.vo.RiskAssessment;

/**
 * 위험도 게이트 통과 결과
 *
 * @param attemptId 감사 기록 ID (가입 결과를 이 기록에 남긴다)
 * @param deviceFingerprint 기기 지문 해시
 */
public record RiskDecision(String attemptId, String deviceFingerprint, RiskAssessment assessment) {

    public boolean flagged() {
        return assessment.flagged();
    }
}
