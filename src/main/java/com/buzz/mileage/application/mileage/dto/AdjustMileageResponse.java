package com.buzz.mileage.application.mileage.dto;

import com.buzz.mileage.domain.ledger.entity.LedgerEntry;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * 관리자 마일리지 조정 응답 DTO
 */
public record AdjustMileageResponse(
        @Schema(description = "계정 ID")
        String accountId,

        @Schema(description = "조정 금액", example = "-1000")
        long amount,

        @Schema(description = "조정 후 잔액", example = "4000")
        long balanceAfter,

        @Schema(description = "원장 항목")
        LedgerEntryResponse entry
) {
    public static AdjustMileageResponse from(LedgerEntry entry) {
        return new AdjustMileageResponse(
                entry.getAccountId(),
                entry.getAmount(),
                entry.getBalanceAfter(),
                LedgerEntryResponse.from(entry)
        );
    }
}
