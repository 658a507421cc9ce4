package com.buzz.mileage.domain.risk.vo;

import java.util.List;

/**
 * 위험도 점수 계산 정책
 */
public record RiskPolicy(
        RiskWeights weights,
        int ipAttemptsWarnThreshold,
        int ipAttemptsHighThreshold,
        int deviceAttemptsThreshold,
        int minUserAgentLength,
        List<String> botUserAgentKeywords
) {
}
