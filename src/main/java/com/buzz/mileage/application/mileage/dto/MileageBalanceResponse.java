package com.buzz.mileage.application.mileage.dto;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 마일리지 잔액 응답 DTO
 */
public record MileageBalanceResponse(
        @Schema(description = "계정 ID")
        String accountId,

        @Schema(description = "현재 잔액", example = "5000")
        long balance
) {
}
