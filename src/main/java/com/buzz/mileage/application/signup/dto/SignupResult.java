package com.buzz.mileage.application.signup.dto;

/**
 * 가입 트랜잭션 결과
 *
 * @param referrerId 추천이 적용된 경우 추천인 ID, 아니면 null
 * @param referralIgnoredReason 추천 코드가 있었지만 적용하지 않은 사유
 */
public record SignupResult(
        String accountId,
        String email,
        String referralCode,
        String referrerId,
        long signupBonus,
        long referrerReward,
        long balance,
        String referralIgnoredReason
) {
}
