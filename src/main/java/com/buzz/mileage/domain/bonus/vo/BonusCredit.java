package com.buzz.mileage.domain.bonus.vo;

import com.buzz.mileage.domain.ledger.entity.LedgerReferenceType;

/**
 * 원장에 적립될 보너스 1건
 */
public record BonusCredit(
        Beneficiary beneficiary,
        long amount,
        LedgerReferenceType referenceType,
        String referenceId,
        String description
) {
}
