package com.buzz.mileage.domain.settlement.vo;

import com.buzz.mileage.domain.settlement.entity.SettlementKind;

/**
 * 정산 금액 구성
 * net = gross - subsidy
 */
public record SettlementAmount(SettlementKind kind, long gross, long subsidy, long net) {

    public SettlementAmount {
        if (gross < 0 || subsidy < 0 || subsidy > gross) {
            throw new IllegalArgumentException(
                    String.format("정산 금액이 올바르지 않습니다. gross=%d, subsidy=%d", gross, subsidy));
        }
        if (net != gross - subsidy) {
            throw new IllegalArgumentException("net 은 gross - subsidy 여야 합니다");
        }
    }

    public static SettlementAmount of(SettlementKind kind, long gross, long subsidy) {
        return new SettlementAmount(kind, gross, subsidy, gross - subsidy);
    }
}
