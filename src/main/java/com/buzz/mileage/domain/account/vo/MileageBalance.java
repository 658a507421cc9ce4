package com.buzz.mileage.domain.account.vo;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;

/**
 * 마일리지 잔액 Value Object
 * 원장 합계의 캐시이며 음수가 될 수 없다. 변경은 AccountRepository 의 원자적 UPDATE 로만 한다.
 */
@Embeddable
public record MileageBalance(@Column(name = "balance", nullable = false) long amount) {

    public MileageBalance {
        if (amount < 0) {
            throw new IllegalArgumentException("마일리지 잔액은 음수일 수 없습니다");
        }
    }

    public static MileageBalance zero() {
        return new MileageBalance(0);
    }
}
