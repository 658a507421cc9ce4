package com.buzz.mileage.domain.ledger.entity;

/**
 * 원장 항목의 발생 원인
 * 가입 보너스 구성(기본/추천/이벤트)을 원장만으로 재구성할 수 있도록 분리한다
 */
public enum LedgerReferenceType {
    SIGNUP,
    REFERRAL,
    EVENT,
    QR_REDEEM,
    ADMIN
}
