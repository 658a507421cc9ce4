package com.buzz.mileage.domain.bonus.vo;

public enum Beneficiary {
    /**
     * 신규 가입자
     */
    REFEREE,

    /**
     * 추천인
     */
    REFERRER
}
