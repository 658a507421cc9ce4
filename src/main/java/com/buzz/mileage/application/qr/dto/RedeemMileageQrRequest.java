package com.buzz.mileage.application.qr.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * 마일리지 QR 사용 요청 DTO
 */
public record RedeemMileageQrRequest(
        @Schema(description = "스캔한 QR 페이로드")
        @NotBlank(message = "QR 데이터는 필수입니다")
        String payload,

        @Schema(description = "가맹점 ID", example = "M001")
        @NotBlank(message = "가맹점 ID는 필수입니다")
        String merchantId,

        @Schema(description = "사용할 마일리지", example = "3000")
        @NotNull(message = "사용 금액은 필수입니다")
        @Min(value = 1, message = "사용 금액은 1 이상이어야 합니다")
        Long amount
) {
}
