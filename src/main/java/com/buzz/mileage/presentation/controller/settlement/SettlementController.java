package com.buzz.mileage.presentation.controller.settlement;

import com.buzz.mileage.application.settlement.dto.ApproveSettlementRequest;
import com.buzz.mileage.application.settlement.dto.RejectSettlementRequest;
import com.buzz.mileage.application.settlement.dto.SettlementResponse;
import com.buzz.mileage.application.settlement.usecase.ApproveSettlementUseCase;
import com.buzz.mileage.application.settlement.usecase.GetMerchantSettlementsUseCase;
import com.buzz.mileage.application.settlement.usecase.PaySettlementUseCase;
import com.buzz.mileage.application.settlement.usecase.RejectSettlementUseCase;
import com.buzz.mileage.domain.settlement.entity.SettlementStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
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
 * 정산 API
 * 승인/반려/지급은 같은 요청을 반복해도 결과가 같다
 */
@Tag(name = "정산", description = "가맹점 정산 조회 및 상태 처리 API")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/settlements")
public class SettlementController {

    private final GetMerchantSettlementsUseCase getMerchantSettlementsUseCase;
    private final ApproveSettlementUseCase approveSettlementUseCase;
    private final RejectSettlementUseCase rejectSettlementUseCase;
    private final PaySettlementUseCase paySettlementUseCase;

    @Operation(summary = "가맹점 정산 목록 조회")
    @GetMapping
    public ResponseEntity<List<SettlementResponse>> list(
            @Parameter(description = "가맹점 ID") @RequestParam String merchantId,
            @Parameter(description = "상태 필터") @RequestParam(required = false) SettlementStatus status) {
        return ResponseEntity.ok(getMerchantSettlementsUseCase.execute(merchantId, status));
    }

    @Operation(summary = "정산 상세 조회")
    @GetMapping("/{settlementId}")
    public ResponseEntity<SettlementResponse> get(@PathVariable String settlementId) {
        return ResponseEntity.ok(getMerchantSettlementsUseCase.getOne(settlementId));
    }

    /**
     * POST /api/settlements/{settlementId}/approve
     */
    @Operation(summary = "정산 승인", description = "REQUESTED → APPROVED. 이미 승인된 정산은 그대로 반환합니다")
    @PostMapping("/{settlementId}/approve")
    public ResponseEntity<SettlementResponse> approve(
            @PathVariable String settlementId,
            @Valid @RequestBody ApproveSettlementRequest request) {
        return ResponseEntity.ok(approveSettlementUseCase.execute(settlementId, request.approverId()));
    }

    /**
     * POST /api/settlements/{settlementId}/reject
     */
    @Operation(summary = "정산 반려", description = "REQUESTED → REJECTED")
    @PostMapping("/{settlementId}/reject")
    public ResponseEntity<SettlementResponse> reject(
            @PathVariable String settlementId,
            @Valid @RequestBody RejectSettlementRequest request) {
        return ResponseEntity.ok(rejectSettlementUseCase.execute(settlementId, request.reason()));
    }

    /**
     * POST /api/settlements/{settlementId}/pay
     */
    @Operation(summary = "정산 지급 완료", description = "APPROVED → PAID")
    @PostMapping("/{settlementId}/pay")
    public ResponseEntity<SettlementResponse> pay(@PathVariable String settlementId) {
        return ResponseEntity.ok(paySettlementUseCase.execute(settlementId));
    }
}
