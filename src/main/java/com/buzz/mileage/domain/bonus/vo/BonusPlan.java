package com.buzz.mileage.domain.bonus.vo;

import java.util.List;

/**
 * 보너스 계산 결과 (적용 전)
 */
public record BonusPlan(List<BonusCredit> credits) {

    public BonusPlan {
        credits = List.copyOf(credits);
    }

    public long totalFor(Beneficiary beneficiary) {
        return credits.stream()
                .filter(c -> c.beneficiary() == beneficiary)
                .mapToLong(BonusCredit::amount)
                .sum();
    }

    public List<BonusCredit> creditsFor(Beneficiary beneficiary) {
        return credits.stream()
                .filter(c -> c.beneficiary() == beneficiary)
                .toList();
    }
}
