package com.buzz.mileage.common.config;

import com.buzz.mileage.domain.bonus.vo.BonusPolicy;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * 마일리지 적립/추천/정산 정책 설정 (buzz.policy.*)
 * 기동 시 한 번 바인딩 및 검증된다
 */
@Data
@Validated
@ConfigurationProperties(prefix = "buzz.policy")
public class MileagePolicyProperties {

    /**
     * 일반 가입 보너스
     */
    @PositiveOrZero
    private long signupBonusDefault = 1000L;

    /**
     * 추천 코드로 가입한 신규 회원 보너스
     */
    @PositiveOrZero
    private long signupBonusReferral = 3000L;

    /**
     * 추천인 보상
     */
    @PositiveOrZero
    private long referralReward = 500L;

    private boolean referralEnabled = true;

    /**
     * 추천인 1명이 윈도우 내에 완료할 수 있는 최대 추천 수
     */
    @Min(1)
    private int referralDailyLimit = 5;

    @NotNull
    private Duration referralWindow = Duration.ofHours(24);

    @NotNull
    private ReferralLimitPolicy referralLimitPolicy = ReferralLimitPolicy.REJECT_SIGNUP;

    /**
     * 이벤트 쿠폰 할인액 중 정부 지원 비율 (%)
     */
    @Min(0)
    @Max(100)
    private int eventCouponGovernmentRatio = 50;

    public BonusPolicy toBonusPolicy() {
        return new BonusPolicy(signupBonusDefault, signupBonusReferral, referralReward);
    }
}
