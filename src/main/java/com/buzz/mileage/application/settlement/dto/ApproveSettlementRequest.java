package com.buzz.mileage.application.settlement.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

public record ApproveSettlementRequest(
        @Schema(description = "승인자 ID", example = "admin01")
        @NotBlank(message = "승인자 ID는 필수입니다")
        String approverId
) {
}
