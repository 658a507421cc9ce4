package com.buzz.mileage.presentation.controller.mileage;

import com.buzz.mileage.application.mileage.dto.AdjustMileageRequest;
import com.buzz.mileage.application.mileage.dto.AdjustMileageResponse;
import com.buzz.mileage.application.mileage.dto.MileageBalanceResponse;
import com.buzz.mileage.application.mileage.dto.MileageHistoryResponse;
import com.buzz.mileage.application.mileage.usecase.AdjustMileageUseCase;
import com.buzz.mileage.application.mileage.usecase.GetMileageBalanceUseCase;
import com.buzz.mileage.application.mileage.usecase.GetMileageHistoryUseCase;
import com.buzz.mileage.domain.ledger.entity.LedgerCategory;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 마일리지 API
 */
@Tag(name = "마일리지", description = "잔액 / 내역 조회 및 관리자 조정 API")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/accounts/{accountId}/mileage")
public class MileageController {

    private final GetMileageBalanceUseCase getMileageBalanceUseCase;
    private final GetMileageHistoryUseCase getMileageHistoryUseCase;
    private final AdjustMileageUseCase adjustMileageUseCase;

    /**
     * 잔액 조회
     * GET /api/accounts/{accountId}/mileage
     */
    @Operation(summary = "마일리지 잔액 조회")
    @GetMapping
    public ResponseEntity<MileageBalanceResponse> getBalance(
            @Parameter(description = "계정 ID") @PathVariable String accountId) {
        return ResponseEntity.ok(getMileageBalanceUseCase.execute(accountId));
    }

    /**
     * 내역 조회
     * GET /api/accounts/{accountId}/mileage/history
     */
    @Operation(summary = "마일리지 내역 조회", description = "원장 항목을 최신순으로 조회합니다")
    @GetMapping("/history")
    public ResponseEntity<MileageHistoryResponse> getHistory(
            @Parameter(description = "계정 ID") @PathVariable String accountId,
            @Parameter(description = "구분 (EARN/SPEND/ADMIN_ADJUST)") @RequestParam(required = false) LedgerCategory category,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(getMileageHistoryUseCase.execute(accountId, category, page, size));
    }

    /**
     * 관리자 조정
     * POST /api/accounts/{accountId}/mileage/adjust
     */
    @Operation(summary = "관리자 마일리지 조정", description = "양수는 적립, 음수는 차감 (잔액 부족 시 실패)")
    @PostMapping("/adjust")
    public ResponseEntity<AdjustMileageResponse> adjust(
            @Parameter(description = "계정 ID") @PathVariable String accountId,
            @Valid @RequestBody AdjustMileageRequest request) {
        return ResponseEntity.ok(adjustMileageUseCase.execute(accountId, request));
    }
}
