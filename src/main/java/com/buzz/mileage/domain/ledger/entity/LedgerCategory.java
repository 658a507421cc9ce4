package com.buzz.mileage.domain.ledger.entity;

/**
 * 원장 항목 분류
 */
public enum LedgerCategory {
    EARN,
    SPEND,
    ADMIN_ADJUST
}
