package com.buzz.mileage.application.qr.dto;

import com.buzz.mileage.domain.settlement.entity.Settlement;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.LocalDateTime;

/**
 * 쿠폰 QR 사용 응답 DTO
 */
public record RedeemCouponQrResponse(
        @Schema(description = "토큰 ID")
        String tokenId,

        @Schema(description = "생성된 정산 ID")
        String settlementId,

        @Schema(description = "쿠폰 ID")
        String couponId,

        @Schema(description = "정산 종류", example = "EVENT_COUPON")
        String settlementKind,

        @Schema(description = "할인 금액", example = "10000")
        long discountAmount,

        @Schema(description = "정부 지원금", example = "5000")
        long subsidyAmount,

        @Schema(description = "정산 순액 (할인 금액 - 지원금)", example = "5000")
        long netAmount,

        @Schema(description = "사용 일시")
        LocalDateTime usedAt
) {
    public static RedeemCouponQrResponse from(String tokenId, Settlement settlement) {
        return new RedeemCouponQrResponse(
                tokenId,
                settlement.getSettlementId(),
                settlement.getCouponId(),
                settlement.getKind().name(),
                settlement.getGrossAmount(),
                settlement.getSubsidyAmount(),
                settlement.getNetAmount(),
                settlement.getRequestedAt()
        );
    }
}
