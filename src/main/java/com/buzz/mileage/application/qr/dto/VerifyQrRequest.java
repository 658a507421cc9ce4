package com.buzz.mileage.application.qr.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * QR 검증 요청 DTO (가맹점 스캔)
 */
public record VerifyQrRequest(
        @Schema(description = "스캔한 QR 페이로드")
        @NotBlank(message = "QR 데이터는 필수입니다")
        String payload
) {
}
