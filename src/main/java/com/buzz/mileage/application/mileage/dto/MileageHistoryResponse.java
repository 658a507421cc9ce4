package com.buzz.mileage.application.mileage.dto;

import com.buzz.mileage.domain.ledger.entity.LedgerEntry;
import io.swagger.v3.oas.annotations.media.Schema;
import java.util.List;
import org.springframework.data.domain.Page;

/**
 * 마일리지 내역 응답 DTO (최신순)
 */
public record MileageHistoryResponse(
        @Schema(description = "계정 ID")
        String accountId,

        @Schema(description = "현재 잔액", example = "5000")
        long balance,

        @Schema(description = "원장 항목")
        List<LedgerEntryResponse> entries,

        @Schema(description = "페이지 번호 (0부터)", example = "0")
        int page,

        @Schema(description = "페이지 크기", example = "20")
        int size,

        @Schema(description = "전체 항목 수", example = "42")
        long totalElements,

        @Schema(description = "전체 페이지 수", example = "3")
        int totalPages
) {
    public static MileageHistoryResponse from(String accountId, long balance, Page<LedgerEntry> page) {
        return new MileageHistoryResponse(
                accountId,
                balance,
                page.getContent().stream().map(LedgerEntryResponse::from).toList(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages()
        );
    }
}
