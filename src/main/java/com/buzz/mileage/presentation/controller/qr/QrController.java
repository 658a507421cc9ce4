package com.buzz.mileage.presentation.controller.qr;

import com.buzz.mileage.application.qr.dto.IssueQrRequest;
import com.buzz.mileage.application.qr.dto.QrTokenResponse;
import com.buzz.mileage.application.qr.dto.RedeemCouponQrRequest;
import com.buzz.mileage.application.qr.dto.RedeemCouponQrResponse;
import com.buzz.mileage.application.qr.dto.RedeemMileageQrRequest;
import com.buzz.mileage.application.qr.dto.RedeemMileageQrResponse;
import com.buzz.mileage.application.qr.dto.VerifyQrRequest;
import com.buzz.mileage.application.qr.dto.VerifyQrResponse;
import com.buzz.mileage.application.qr.usecase.IssueCouponQrUseCase;
import com.buzz.mileage.application.qr.usecase.IssueMileageQrUseCase;
import com.buzz.mileage.application.qr.usecase.RedeemCouponQrUseCase;
import com.buzz.mileage.application.qr.usecase.RedeemMileageQrUseCase;
import com.buzz.mileage.application.qr.usecase.VerifyQrUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * QR 발급 / 검증 / 사용 API
 *
 * 가맹점 흐름: 스캔 → verify (내용 확인, 상태 변경 없음) → redeem (확정)
 */
@Tag(name = "QR", description = "마일리지/쿠폰 QR 발급 및 가맹점 사용 API")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/qr")
public class QrController {

    private final IssueMileageQrUseCase issueMileageQrUseCase;
    private final IssueCouponQrUseCase issueCouponQrUseCase;
    private final VerifyQrUseCase verifyQrUseCase;
    private final RedeemMileageQrUseCase redeemMileageQrUseCase;
    private final RedeemCouponQrUseCase redeemCouponQrUseCase;

    /**
     * 마일리지 QR 발급
     * POST /api/qr/mileage
     */
    @Operation(summary = "마일리지 QR 발급", description = "잔액이 있는 계정에 짧은 유효시간의 마일리지 사용 QR 을 발급합니다")
    @PostMapping("/mileage")
    public ResponseEntity<QrTokenResponse> issueMileageQr(@Valid @RequestBody IssueQrRequest request) {
        return ResponseEntity.ok(issueMileageQrUseCase.execute(request.accountId()));
    }

    /**
     * 쿠폰 QR 발급
     * POST /api/qr/coupons/{couponId}
     */
    @Operation(summary = "쿠폰 QR 발급", description = "본인 소유의 미사용 쿠폰에 대한 사용 QR 을 발급합니다")
    @PostMapping("/coupons/{couponId}")
    public ResponseEntity<QrTokenResponse> issueCouponQr(
            @Parameter(description = "쿠폰 ID") @PathVariable String couponId,
            @Valid @RequestBody IssueQrRequest request) {
        return ResponseEntity.ok(issueCouponQrUseCase.execute(request.accountId(), couponId));
    }

    /**
     * QR 검증 (가맹점)
     * POST /api/qr/verify
     */
    @Operation(summary = "QR 검증", description = "QR 유효성을 확인하고 고객/쿠폰 정보를 반환합니다. QR 을 사용 처리하지 않습니다")
    @PostMapping("/verify")
    public ResponseEntity<VerifyQrResponse> verify(@Valid @RequestBody VerifyQrRequest request) {
        return ResponseEntity.ok(verifyQrUseCase.execute(request.payload()));
    }

    /**
     * 마일리지 QR 사용 (가맹점)
     * POST /api/qr/redeem/mileage
     */
    @Operation(summary = "마일리지 QR 사용", description = "마일리지를 차감하고 정산 요청을 생성합니다")
    @PostMapping("/redeem/mileage")
    public ResponseEntity<RedeemMileageQrResponse> redeemMileage(@Valid @RequestBody RedeemMileageQrRequest request) {
        return ResponseEntity.ok(redeemMileageQrUseCase.execute(request));
    }

    /**
     * 쿠폰 QR 사용 (가맹점)
     * POST /api/qr/redeem/coupon
     */
    @Operation(summary = "쿠폰 QR 사용", description = "쿠폰을 사용 처리하고 정산 요청을 생성합니다 (이벤트 쿠폰은 정부 지원금 분리)")
    @PostMapping("/redeem/coupon")
    public ResponseEntity<RedeemCouponQrResponse> redeemCoupon(@Valid @RequestBody RedeemCouponQrRequest request) {
        return ResponseEntity.ok(redeemCouponQrUseCase.execute(request));
    }
}
