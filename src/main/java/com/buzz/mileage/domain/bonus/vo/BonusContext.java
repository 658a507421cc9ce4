package com.buzz.mileage.domain.bonus.vo;

import com.buzz.mileage.domain.promotion.vo.ActivePromotion;

/**
 * 보너스 계산 입력
 *
 * @param refereeId 신규 가입 계정 ID
 * @param referrerId 유효한 추천인 ID (추천 없음이면 null)
 * @param signupEvent 진행 중 SIGNUP_BONUS 이벤트 (없으면 null)
 * @param referralEvent 진행 중 REFERRAL_BONUS 이벤트 (없으면 null)
 */
public record BonusContext(
        BonusPolicy policy,
        String refereeId,
        String referrerId,
        ActivePromotion signupEvent,
        ActivePromotion referralEvent
) {

    public boolean referred() {
        return referrerId != null;
    }
}
