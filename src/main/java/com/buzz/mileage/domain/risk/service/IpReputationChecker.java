package com.buzz.mileage.domain.risk.service;

import com.buzz.mileage.domain.risk.vo.IpReputation;

/**
 * IP 평판 판정 (교체 가능한 외부 판정기)
 */
public interface IpReputationChecker {

    IpReputation check(String ipAddress);
}
