package com.buzz.mileage.application.settlement.dto;

import com.buzz.mileage.domain.settlement.entity.Settlement;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.LocalDateTime;

/**
 * 정산 응답 DTO
 */
public record SettlementResponse(
        @Schema(description = "정산 ID")
        String settlementId,

        @Schema(description = "가맹점 ID", example = "M001")
        String merchantId,

        @Schema(description = "정산 종류", example = "EVENT_COUPON")
        String kind,

        @Schema(description = "총액 (할인액 또는 마일리지 사용액)", example = "10000")
        long grossAmount,

        @Schema(description = "정부 지원금", example = "5000")
        long subsidyAmount,

        @Schema(description = "정산 순액", example = "5000")
        long netAmount,

        @Schema(description = "상태", example = "REQUESTED")
        String status,

        @Schema(description = "QR 토큰 ID")
        String tokenId,

        @Schema(description = "쿠폰 ID")
        String couponId,

        LocalDateTime requestedAt,
        LocalDateTime approvedAt,
        String approvedBy,
        LocalDateTime paidAt,
        LocalDateTime rejectedAt,
        String rejectionReason
) {
    public static SettlementResponse from(Settlement settlement) {
        return new SettlementResponse(
                settlement.getSettlementId(),
                settlement.getMerchantId(),
                settlement.getKind().name(),
                settlement.getGrossAmount(),
                settlement.getSubsidyAmount(),
                settlement.getNetAmount(),
                settlement.getStatus().name(),
                settlement.getReferenceId(),
                settlement.getCouponId(),
                settlement.getRequestedAt(),
                settlement.getApprovedAt(),
                settlement.getApprovedBy(),
                settlement.getPaidAt(),
                settlement.getRejectedAt(),
                settlement.getRejectionReason()
        );
    }
}
