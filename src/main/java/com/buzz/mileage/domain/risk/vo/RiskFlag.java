package com.buzz.mileage.domain.risk.vo;

public enum RiskFlag {
    TOR,
    VPN,
    DATACENTER,
    BLACKLISTED,
    MISSING_USER_AGENT,
    BOT_USER_AGENT,
    IP_ATTEMPTS_WARN,
    IP_ATTEMPTS_HIGH,
    DEVICE_BLOCKED,
    DEVICE_ATTEMPTS,
    TRUSTED_IP,
    /**
     * 신호 수집 실패로 점수 없이 통과시킨 경우
     */
    SCORER_UNAVAILABLE
}
