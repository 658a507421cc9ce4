package com.buzz.mileage.application.mileage.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * 관리자 마일리지 조정 요청 DTO
 */
public record AdjustMileageRequest(
        @Schema(description = "조정 금액 (음수면 차감)", example = "-1000")
        @NotNull(message = "조정 금액은 필수입니다")
        Long amount,

        @Schema(description = "조정 사유", example = "중복 적립 회수")
        @NotBlank(message = "조정 사유는 필수입니다")
        @Size(max = 200, message = "조정 사유는 200자 이하여야 합니다")
        String description,

        @Schema(description = "처리 관리자 ID", example = "admin01")
        @NotBlank(message = "관리자 ID는 필수입니다")
        String adminId
) {
}
