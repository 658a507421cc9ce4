package com.buzz.mileage.domain.risk.vo;

/**
 * IP 평판 (외부 판정 결과)
 */
public record IpReputation(boolean tor, boolean vpn, boolean datacenter, boolean blacklisted) {

    public static IpReputation clean() {
        return new IpReputation(false, false, false, false);
    }
}
