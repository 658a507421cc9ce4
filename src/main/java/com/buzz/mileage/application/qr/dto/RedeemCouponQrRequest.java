package com.buzz.mileage.application.qr.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * 쿠폰 QR 사용 요청 DTO
 */
public record RedeemCouponQrRequest(
        @Schema(description = "스캔한 QR 페이로드")
        @NotBlank(message = "QR 데이터는 필수입니다")
        String payload,

        @Schema(description = "가맹점 ID", example = "M001")
        @NotBlank(message = "가맹점 ID는 필수입니다")
        String merchantId,

        @Schema(description = "주문 금액 (정률 쿠폰은 필수)", example = "20000")
        @Min(value = 1, message = "주문 금액은 1 이상이어야 합니다")
        Long orderAmount
) {
}
