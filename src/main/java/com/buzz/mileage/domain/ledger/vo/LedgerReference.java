package com.buzz.mileage.domain.ledger.vo;

import com.buzz.mileage.domain.ledger.entity.LedgerReferenceType;
import java.util.Objects;

/**
 * 원장 항목이 가리키는 원인 (type + id)
 */
public record LedgerReference(LedgerReferenceType type, String id) {

    public LedgerReference {
        Objects.requireNonNull(type, "referenceType");
    }

    public static LedgerReference of(LedgerReferenceType type, String id) {
        return new LedgerReference(type, id);
    }
}
