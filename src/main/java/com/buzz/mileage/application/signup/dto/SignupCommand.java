package com.buzz.mileage.application.signup.dto;

import java.util.Locale;

/**
 * 가입 처리 입력 (요청 본문 + 접속 정보)
 */
public record SignupCommand(
        String email,
        String name,
        String phone,
        String referralCode,
        String ipAddress,
        String userAgent,
        String clientFingerprint
) {

    public static SignupCommand of(SignupRequest request, String ipAddress, String userAgent) {
        return new SignupCommand(
                request.email().trim().toLowerCase(Locale.ROOT),
                request.name().trim(),
                blankToNull(request.phone()),
                normalizeCode(request.referralCode()),
                ipAddress,
                userAgent,
                blankToNull(request.deviceFingerprint()));
    }

    public boolean hasReferralCode() {
        return referralCode != null;
    }

    /**
     * 추천 코드는 대문자로 비교한다
     */
    public static String normalizeCode(String code) {
        String value = blankToNull(code);
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }

    private static String blankToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim();
    }
}
