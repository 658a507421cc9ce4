package com.buzz.mileage.domain.referral.service;

/**
 * 추천 코드 후보 생성
 * 유일성 확인은 호출 측에서 한다
 */
public interface ReferralCodeGenerator {

    String generate(String name);

    /**
     * 후보 생성이 계속 충돌할 때 사용하는 대체 코드
     */
    String fallback();
}
