package com.buzz.mileage.application.qr.dto;

import com.buzz.mileage.domain.account.entity.Account;
import com.buzz.mileage.domain.coupon.entity.Coupon;
import com.buzz.mileage.domain.token.vo.TokenVerification;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.LocalDateTime;

/**
 * QR 검증 응답 DTO
 * 실패는 reason 코드로만 전달한다 (expired, already_used, not_found, inactive_account ...)
 */
public record VerifyQrResponse(
        @Schema(description = "사용 가능 여부", example = "true")
        boolean valid,

        @Schema(description = "실패 사유 코드", example = "expired")
        String reason,

        @Schema(description = "토큰 ID")
        String tokenId,

        @Schema(description = "토큰 종류", example = "COUPON")
        String kind,

        @Schema(description = "만료 일시")
        LocalDateTime expiresAt,

        @Schema(description = "계정 ID")
        String accountId,

        @Schema(description = "고객 이름", example = "김버즈")
        String accountName,

        @Schema(description = "마일리지 잔액 (마일리지 QR)", example = "5000")
        Long balance,

        @Schema(description = "쿠폰 정보 (쿠폰 QR)")
        CouponSummary coupon
) {

    public record CouponSummary(
            String couponId,
            String name,
            String kind,
            String discountMode,
            long discountValue,
            LocalDateTime expiresAt
    ) {
        static CouponSummary from(Coupon coupon) {
            return new CouponSummary(
                    coupon.getCouponId(),
                    coupon.getName(),
                    coupon.getKind().name(),
                    coupon.getDiscountMode().name(),
                    coupon.getDiscountValue(),
                    coupon.getExpiresAt());
        }
    }

    public static VerifyQrResponse from(TokenVerification verification) {
        if (!verification.valid()) {
            return new VerifyQrResponse(false, verification.failure().reasonCode(),
                    verification.token() == null ? null : verification.token().getTokenId(),
                    verification.token() == null ? null : verification.token().getKind().name(),
                    verification.token() == null ? null : verification.token().getExpiresAt(),
                    null, null, null, null);
        }

        Account account = verification.account();
        Coupon coupon = verification.coupon();
        return new VerifyQrResponse(
                true,
                null,
                verification.token().getTokenId(),
                verification.token().getKind().name(),
                verification.token().getExpiresAt(),
                account.getAccountId(),
                account.getName(),
                coupon == null ? account.getBalanceAmount() : null,
                coupon == null ? null : CouponSummary.from(coupon));
    }
}
