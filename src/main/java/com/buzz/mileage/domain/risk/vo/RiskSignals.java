package com.buzz.mileage.domain.risk.vo;

/**
 * 위험도 계산 입력
 *
 * @param recentIpAttempts 같은 IP 의 최근 윈도우 내 가입 시도 수 (이번 시도 제외)
 * @param deviceBlocked 같은 기기 지문에 차단 이력이 있는지
 * @param deviceAttempts 같은 기기 지문의 누적 가입 시도 수
 */
public record RiskSignals(
        String userAgent,
        IpReputation ipReputation,
        long recentIpAttempts,
        boolean deviceBlocked,
        int deviceAttempts
) {
}
