package com.buzz.mileage.domain.settlement.service;

import com.buzz.mileage.common.config.MileagePolicyProperties;
import com.buzz.mileage.domain.coupon.entity.CouponKind;
import com.buzz.mileage.domain.settlement.entity.SettlementKind;
import com.buzz.mileage.domain.settlement.vo.SettlementAmount;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * 정산 금액 계산 (부수효과 없음)
 *
 * - 마일리지 사용: gross = 사용 금액, 지원금 0
 * - 일반 쿠폰: gross = 할인액, 지원금 0
 * - 이벤트 쿠폰: 지원금 = floor(할인액 * 정부지원비율 / 100), net = gross - 지원금
 */
@Component
public class SettlementCalculator {

    private final int governmentRatio;

    @Autowired
    public SettlementCalculator(MileagePolicyProperties policy) {
        this(policy.getEventCouponGovernmentRatio());
    }

    public SettlementCalculator(int governmentRatio) {
        if (governmentRatio < 0 || governmentRatio > 100) {
            throw new IllegalArgumentException("정부 지원 비율은 0~100 사이여야 합니다: " + governmentRatio);
        }
        this.governmentRatio = governmentRatio;
    }

    public SettlementAmount forMileage(long spendAmount) {
        return SettlementAmount.of(SettlementKind.MILEAGE_USE, spendAmount, 0L);
    }

    public SettlementAmount forCoupon(CouponKind couponKind, long discountAmount) {
        if (couponKind == CouponKind.EVENT) {
            long subsidy = discountAmount * governmentRatio / 100;
            return SettlementAmount.of(SettlementKind.EVENT_COUPON, discountAmount, subsidy);
        }
        return SettlementAmount.of(SettlementKind.BASIC_COUPON, discountAmount, 0L);
    }
}
