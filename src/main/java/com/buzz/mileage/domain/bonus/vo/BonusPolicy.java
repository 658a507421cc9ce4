package com.buzz.mileage.domain.bonus.vo;

/**
 * 보너스 기본값
 */
public record BonusPolicy(long signupBonusDefault, long signupBonusReferral, long referralReward) {
}
