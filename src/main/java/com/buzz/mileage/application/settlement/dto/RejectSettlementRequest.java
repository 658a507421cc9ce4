package com.buzz.mileage.application.settlement.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record RejectSettlementRequest(
        @Schema(description = "반려 사유", example = "영수증 불일치")
        @NotBlank(message = "반려 사유는 필수입니다")
        @Size(max = 255, message = "반려 사유는 255자 이하여야 합니다")
        String reason
) {
}
