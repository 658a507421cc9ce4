package com.buzz.mileage.domain.risk.service;

import com.buzz.mileage.common.config.RiskProperties;
import com.buzz.mileage.domain.risk.vo.IpReputation;
import com.buzz.mileage.domain.risk.vo.RiskAssessment;
import com.buzz.mileage.domain.risk.vo.RiskFlag;
import com.buzz.mileage.domain.risk.vo.RiskPolicy;
import com.buzz.mileage.domain.risk.vo.RiskSignals;
import com.buzz.mileage.domain.risk.vo.RiskWeights;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 가입 위험도 점수 계산 (순수 함수)
 *
 * 각 신호의 가중치를 더한 뒤 [0, 100] 으로 자른다.
 * 단일 신호로 차단 여부가 정해지지 않도록 차단 기준은 RiskGate 의 threshold 가 결정한다.
 */
@Component
public class RiskScorer {

    private static final int MAX_SCORE = 100;

    private final RiskPolicy policy;

    @Autowired
    public RiskScorer(RiskProperties properties) {
        this(properties.toRiskPolicy());
    }

    public RiskScorer(RiskPolicy policy) {
        this.policy = policy;
    }

    public RiskAssessment score(RiskSignals signals) {
        RiskWeights weights = policy.weights();
        Set<RiskFlag> flags = EnumSet.noneOf(RiskFlag.class);
        List<String> factors = new ArrayList<>();
        int score = 0;

        IpReputation reputation = signals.ipReputation() == null ? IpReputation.clean() : signals.ipReputation();
        if (reputation.tor()) {
            score += apply(flags, factors, RiskFlag.TOR, weights.tor(), "Tor 출구 노드 IP");
        }
        if (reputation.vpn()) {
            score += apply(flags, factors, RiskFlag.VPN, weights.vpn(), "VPN/프록시 IP");
        }
        if (reputation.datacenter()) {
            score += apply(flags, factors, RiskFlag.DATACENTER, weights.datacenter(), "데이터센터 IP");
        }
        if (reputation.blacklisted()) {
            score += apply(flags, factors, RiskFlag.BLACKLISTED, weights.blacklisted(), "차단 목록 IP");
        }

        String userAgent = signals.userAgent();
        if (userAgent == null || userAgent.isBlank() || userAgent.length() < policy.minUserAgentLength()) {
            score += apply(flags, factors, RiskFlag.MISSING_USER_AGENT, weights.missingUserAgent(), "User-Agent 없음/비정상");
        }
        if (userAgent != null && isBotLike(userAgent)) {
            score += apply(flags, factors, RiskFlag.BOT_USER_AGENT, weights.botUserAgent(), "봇 User-Agent");
        }

        if (signals.recentIpAttempts() >= policy.ipAttemptsWarnThreshold()) {
            score += apply(flags, factors, RiskFlag.IP_ATTEMPTS_WARN, weights.ipAttemptsWarn(),
                    "동일 IP 최근 시도 " + signals.recentIpAttempts() + "회");
        }
        if (signals.recentIpAttempts() >= policy.ipAttemptsHighThreshold()) {
            score += apply(flags, factors, RiskFlag.IP_ATTEMPTS_HIGH, weights.ipAttemptsHigh(),
                    "동일 IP 과다 시도");
        }

        if (signals.deviceBlocked()) {
            score += apply(flags, factors, RiskFlag.DEVICE_BLOCKED, weights.deviceBlocked(), "차단 이력 기기");
        }
        if (signals.deviceAttempts() > policy.deviceAttemptsThreshold()) {
            score += apply(flags, factors, RiskFlag.DEVICE_ATTEMPTS, weights.deviceAttempts(),
                    "동일 기기 가입 시도 " + signals.deviceAttempts() + "회");
        }

        return new RiskAssessment(Math.max(0, Math.min(MAX_SCORE, score)), flags, factors);
    }

    private boolean isBotLike(String userAgent) {
        String lower = userAgent.toLowerCase(Locale.ROOT);
        return policy.botUserAgentKeywords().stream()
                .anyMatch(keyword -> lower.contains(keyword.toLowerCase(Locale.ROOT)));
    }

    private static int apply(Set<RiskFlag> flags, List<String> factors, RiskFlag flag, int weight, String description) {
        flags.add(flag);
        factors.add(description + " (+" + weight + ")");
        return weight;
    }
}
