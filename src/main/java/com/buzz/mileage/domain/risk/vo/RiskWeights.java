package com.buzz.mileage.domain.risk.vo;

public record RiskWeights(
        int tor,
        int vpn,
        int datacenter,
        int blacklisted,
        int missingUserAgent,
        int botUserAgent,
        int ipAttemptsWarn,
        int ipAttemptsHigh,
        int deviceBlocked,
        int deviceAttempts
) {
}
