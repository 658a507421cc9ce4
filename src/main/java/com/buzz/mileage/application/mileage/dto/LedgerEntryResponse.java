package com.buzz.mileage.application.mileage.dto;

import com.buzz.mileage.domain.ledger.entity.LedgerEntry;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.LocalDateTime;

/**
 * 원장 항목 응답 DTO
 */
public record LedgerEntryResponse(
        @Schema(description = "원장 항목 ID")
        String entryId,

        @Schema(description = "금액 (적립 +, 사용 -)", example = "-3000")
        long amount,

        @Schema(description = "구분", example = "SPEND")
        String category,

        @Schema(description = "설명", example = "가맹점 QR 사용 - M001")
        String description,

        @Schema(description = "원인 종류", example = "QR_REDEEM")
        String referenceType,

        @Schema(description = "원인 ID")
        String referenceId,

        @Schema(description = "반영 후 잔액", example = "2000")
        long balanceAfter,

        @Schema(description = "일시")
        LocalDateTime createdAt
) {
    public static LedgerEntryResponse from(LedgerEntry entry) {
        return new LedgerEntryResponse(
                entry.getEntryId(),
                entry.getAmount(),
                entry.getCategory().name(),
                entry.getDescription(),
                entry.getReferenceType().name(),
                entry.getReferenceId(),
                entry.getBalanceAfter(),
                entry.getCreatedAt()
        );
    }
}
