package com.buzz.mileage.application.signup.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 회원 가입 응답 DTO
 */
public record SignupResponse(
        @Schema(description = "계정 ID", example = "3f0e2a8c-6a55-4c1f-9c7a-2d9b1d4e7f10")
        String accountId,

        @Schema(description = "이메일", example = "buzz@example.com")
        String email,

        @Schema(description = "내 추천 코드", example = "KIM3F9A1C")
        String referralCode,

        @Schema(description = "추천 적용 여부", example = "true")
        boolean referred,

        @Schema(description = "지급된 가입 보너스 합계", example = "3000")
        long signupBonus,

        @Schema(description = "가입 후 마일리지 잔액", example = "3000")
        long balance,

        @Schema(description = "위험도 점수", example = "20")
        int riskScore,

        @Schema(description = "추천 코드 미적용 사유 (적용되었거나 코드가 없으면 null)")
        String referralNotice
) {
    public static SignupResponse from(SignupResult result, RiskDecision decision) {
        return new SignupResponse(
                result.accountId(),
                result.email(),
                result.referralCode(),
                result.referrerId() != null,
                result.signupBonus(),
                result.balance(),
                decision.assessment().score(),
                result.referralIgnoredReason()
        );
    }
}
