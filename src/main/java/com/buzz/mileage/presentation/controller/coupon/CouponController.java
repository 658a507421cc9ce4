package com.buzz.mileage.presentation.controller.coupon;

import com.buzz.mileage.application.coupon.dto.CouponResponse;
import com.buzz.mileage.application.coupon.dto.IssueCouponRequest;
import com.buzz.mileage.application.coupon.usecase.GetAccountCouponsUseCase;
import com.buzz.mileage.application.coupon.usecase.IssueCouponUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 쿠폰 API
 */
@Tag(name = "쿠폰", description = "쿠폰 지급 및 보유 쿠폰 조회 API")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/accounts/{accountId}/coupons")
public class CouponController {

    private final IssueCouponUseCase issueCouponUseCase;
    private final GetAccountCouponsUseCase getAccountCouponsUseCase;

    /**
     * 쿠폰 지급 (관리자)
     * POST /api/accounts/{accountId}/coupons
     */
    @Operation(summary = "쿠폰 지급", description = "계정에 기본/이벤트 쿠폰을 지급합니다 (관리자)")
    @PostMapping
    public ResponseEntity<CouponResponse> issue(
            @Parameter(description = "계정 ID") @PathVariable String accountId,
            @Valid @RequestBody IssueCouponRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(issueCouponUseCase.execute(accountId, request));
    }

    /**
     * 보유 쿠폰 목록
     * GET /api/accounts/{accountId}/coupons
     */
    @Operation(summary = "보유 쿠폰 목록 조회")
    @GetMapping
    public ResponseEntity<List<CouponResponse>> list(
            @Parameter(description = "계정 ID") @PathVariable String accountId,
            @Parameter(description = "사용 여부 필터") @RequestParam(required = false) Boolean used) {
        return ResponseEntity.ok(getAccountCouponsUseCase.execute(accountId, used));
    }
}
