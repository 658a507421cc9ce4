package com.buzz.mileage.application.qr.dto;

import com.buzz.mileage.domain.ledger.entity.LedgerEntry;
import com.buzz.mileage.domain.settlement.entity.Settlement;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.LocalDateTime;

/**
 * 마일리지 QR 사용 응답 DTO
 */
public record RedeemMileageQrResponse(
        @Schema(description = "토큰 ID")
        String tokenId,

        @Schema(description = "생성된 정산 ID")
        String settlementId,

        @Schema(description = "계정 ID")
        String accountId,

        @Schema(description = "사용한 마일리지", example = "3000")
        long amount,

        @Schema(description = "사용 후 잔액", example = "2000")
        long balanceAfter,

        @Schema(description = "사용 일시")
        LocalDateTime usedAt
) {
    public static RedeemMileageQrResponse from(String tokenId, LedgerEntry entry, Settlement settlement) {
        return new RedeemMileageQrResponse(
                tokenId,
                settlement.getSettlementId(),
                entry.getAccountId(),
                -entry.getAmount(),
                entry.getBalanceAfter(),
                entry.getCreatedAt()
        );
    }
}
