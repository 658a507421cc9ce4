package com.buzz.mileage.domain.settlement.entity;

/**
 * 정산 상태
 * REQUESTED → APPROVED → PAID, 또는 REQUESTED → REJECTED
 */
public enum SettlementStatus {
    REQUESTED,
    APPROVED,
    PAID,
    REJECTED
}
