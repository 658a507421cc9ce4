package com.buzz.mileage.application.coupon.dto;

import com.buzz.mileage.domain.coupon.entity.Coupon;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.LocalDateTime;

/**
 * 쿠폰 응답 DTO
 */
public record CouponResponse(
        @Schema(description = "쿠폰 ID")
        String couponId,

        @Schema(description = "소유 계정 ID")
        String ownerAccountId,

        @Schema(description = "쿠폰 이름", example = "지역 상권 살리기 10,000원 할인")
        String name,

        @Schema(description = "쿠폰 종류", example = "EVENT")
        String kind,

        @Schema(description = "할인 방식", example = "AMOUNT")
        String discountMode,

        @Schema(description = "할인 값", example = "10000")
        long discountValue,

        @Schema(description = "만료 일시")
        LocalDateTime expiresAt,

        @Schema(description = "사용 여부", example = "false")
        boolean used,

        @Schema(description = "사용 가맹점 ID")
        String usedByMerchantId,

        @Schema(description = "사용 일시")
        LocalDateTime usedAt
) {
    public static CouponResponse from(Coupon coupon) {
        return new CouponResponse(
                coupon.getCouponId(),
                coupon.getOwnerAccountId(),
                coupon.getName(),
                coupon.getKind().name(),
                coupon.getDiscountMode().name(),
                coupon.getDiscountValue(),
                coupon.getExpiresAt(),
                coupon.isUsed(),
                coupon.getUsedByMerchantId(),
                coupon.getUsedAt()
        );
    }
}
