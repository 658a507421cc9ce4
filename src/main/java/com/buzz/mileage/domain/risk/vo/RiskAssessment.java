package com.buzz.mileage.domain.risk.vo;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 위험도 평가 결과
 *
 * @param score 0~100
 * @param flags 기여한 신호
 * @param factors 감사 로그용 설명
 */
public record RiskAssessment(int score, Set<RiskFlag> flags, List<String> factors) {

    public RiskAssessment {
        flags = flags.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(flags));
        factors = List.copyOf(factors);
    }

    public static RiskAssessment trusted() {
        return new RiskAssessment(0, EnumSet.of(RiskFlag.TRUSTED_IP), List.of("신뢰 IP - 점수 계산 생략"));
    }

    /**
     * 점수를 계산하지 못했을 때 (통과 + 감사 표시)
     */
    public static RiskAssessment unavailable(String reason) {
        return new RiskAssessment(0, EnumSet.of(RiskFlag.SCORER_UNAVAILABLE), List.of("위험도 평가 불가: " + reason));
    }

    public boolean flagged() {
        return flags.stream().anyMatch(f -> f != RiskFlag.TRUSTED_IP);
    }

    public boolean has(RiskFlag flag) {
        return flags.contains(flag);
    }
}
