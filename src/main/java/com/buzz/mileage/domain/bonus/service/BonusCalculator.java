package com.buzz.mileage.domain.bonus.service;

import com.buzz.mileage.domain.bonus.vo.Beneficiary;
import com.buzz.mileage.domain.bonus.vo.BonusContext;
import com.buzz.mileage.domain.bonus.vo.BonusCredit;
import com.buzz.mileage.domain.bonus.vo.BonusPlan;
import com.buzz.mileage.domain.bonus.vo.BonusPolicy;
import com.buzz.mileage.domain.ledger.entity.LedgerReferenceType;
import com.buzz.mileage.domain.promotion.vo.ActivePromotion;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * 가입/추천 보너스 계산 (순수 함수)
 *
 * 1. 추천 없음: 기본 가입 보너스 (SIGNUP)
 * 2. 유효한 추천: 피추천인은 max(기본, 추천 가입 보너스) (REFERRAL), 추천인은 추천 보상 (REFERRAL)
 * 3. SIGNUP_BONUS 이벤트 금액이 1~2 결과보다 크면 피추천인에게 차액 (EVENT)
 * 4. REFERRAL_BONUS 이벤트 금액이 추천 보상보다 크면 추천인에게 차액 (EVENT)
 *
 * 합산이 아니라 "가장 큰 값까지 끌어올리고 차액을 따로 기록"하는 방식이라
 * 원장만 보고도 기본/추천/이벤트 기여분을 분리할 수 있다.
 * 0원 항목은 만들지 않는다.
 */
@Component
public class BonusCalculator {

    public BonusPlan compute(BonusContext context) {
        BonusPolicy policy = context.policy();
        List<BonusCredit> credits = new ArrayList<>();

        long refereeBase;
        if (context.referred()) {
            refereeBase = Math.max(policy.signupBonusDefault(), policy.signupBonusReferral());
            add(credits, Beneficiary.REFEREE, refereeBase, LedgerReferenceType.REFERRAL,
                    context.referrerId(), "추천 가입 보너스");
            add(credits, Beneficiary.REFERRER, policy.referralReward(), LedgerReferenceType.REFERRAL,
                    context.refereeId(), "추천 보상");
        } else {
            refereeBase = policy.signupBonusDefault();
            add(credits, Beneficiary.REFEREE, refereeBase, LedgerReferenceType.SIGNUP,
                    context.refereeId(), "가입 보너스");
        }

        ActivePromotion signupEvent = context.signupEvent();
        if (signupEvent != null && signupEvent.bonusAmount() > refereeBase) {
            add(credits, Beneficiary.REFEREE, signupEvent.bonusAmount() - refereeBase, LedgerReferenceType.EVENT,
                    signupEvent.eventId(), "이벤트 가입 보너스 차액: " + signupEvent.title());
        }

        ActivePromotion referralEvent = context.referralEvent();
        if (context.referred() && referralEvent != null && referralEvent.bonusAmount() > policy.referralReward()) {
            add(credits, Beneficiary.REFERRER, referralEvent.bonusAmount() - policy.referralReward(),
                    LedgerReferenceType.EVENT, referralEvent.eventId(), "이벤트 추천 보상 차액: " + referralEvent.title());
        }

        return new BonusPlan(credits);
    }

    private static void add(List<BonusCredit> credits, Beneficiary beneficiary, long amount,
                            LedgerReferenceType referenceType, String referenceId, String description) {
        if (amount > 0) {
            credits.add(new BonusCredit(beneficiary, amount, referenceType, referenceId, description));
        }
    }
}
