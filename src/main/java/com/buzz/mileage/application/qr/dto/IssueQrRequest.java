package com.buzz.mileage.application.qr.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

/**
 * QR 발급 요청 DTO
 */
public record IssueQrRequest(
        @Schema(description = "QR 을 제시할 계정 ID", example = "3f0e2a8c-6a55-4c1f-9c7a-2d9b1d4e7f10")
        @NotBlank(message = "계정 ID는 필수입니다")
        String accountId
) {
}
