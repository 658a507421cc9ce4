package com.buzz.mileage.common.config;

import com.buzz.mileage.domain.risk.vo.RiskPolicy;
import com.buzz.mileage.domain.risk.vo.RiskWeights;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 가입 위험도 평가 설정 (buzz.risk.*)
 * 가중치는 운영 중 튜닝 대상이므로 전부 설정으로 노출한다
 */
@Data
@Validated
@ConfigurationProperties(prefix = "buzz.risk")
public class RiskProperties {

    /**
     * 이 점수 이상이면 가입 차단
     */
    @Min(1)
    @Max(101)
    private int blockThreshold = 70;

    @NotNull
    private Duration attemptWindow = Duration.ofHours(24);

    private int ipAttemptsWarnThreshold = 3;
    private int ipAttemptsHighThreshold = 5;
    private int deviceAttemptsThreshold = 5;
    private int minUserAgentLength = 10;

    private List<String> botUserAgentKeywords = new ArrayList<>(List.of("bot", "crawler", "spider"));

    /**
     * 점수 계산을 건너뛰는 내부/테스트 IP
     */
    private List<String> trustedIps = new ArrayList<>();

    private List<String> torExitNodes = new ArrayList<>();
    private List<String> vpnPrefixes = new ArrayList<>();
    private List<String> datacenterPrefixes = new ArrayList<>(List.of("18.", "35.", "52."));

    @Valid
    @NotNull
    private Weights weights = new Weights();

    @Data
    public static class Weights {
        @Min(0) private int tor = 50;
        @Min(0) private int vpn = 40;
        @Min(0) private int datacenter = 30;
        @Min(0) private int blacklisted = 50;
        @Min(0) private int missingUserAgent = 20;
        @Min(0) private int botUserAgent = 30;
        @Min(0) private int ipAttemptsWarn = 20;
        @Min(0) private int ipAttemptsHigh = 30;
        @Min(0) private int deviceBlocked = 50;
        @Min(0) private int deviceAttempts = 20;
    }

    public RiskPolicy toRiskPolicy() {
        RiskWeights riskWeights = new RiskWeights(
                weights.tor, weights.vpn, weights.datacenter, weights.blacklisted,
                weights.missingUserAgent, weights.botUserAgent,
                weights.ipAttemptsWarn, weights.ipAttemptsHigh,
                weights.deviceBlocked, weights.deviceAttempts);

        return new RiskPolicy(
                riskWeights,
                ipAttemptsWarnThreshold,
                ipAttemptsHighThreshold,
                deviceAttemptsThreshold,
                minUserAgentLength,
                List.copyOf(botUserAgentKeywords));
    }
}
