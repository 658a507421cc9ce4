package com.buzz.mileage.common.config;

/**
 * 추천인이 추천 한도를 초과했을 때의 처리 정책
 */
public enum ReferralLimitPolicy {
    /**
     * 가입 자체를 거절
     */
    REJECT_SIGNUP,

    /**
     * 추천 혜택 없이 일반 가입으로 진행
     */
    SIGNUP_WITHOUT_REFERRAL
}
