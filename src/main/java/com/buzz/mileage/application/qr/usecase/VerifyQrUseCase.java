package com.buzz.mileage.application.qr.usecase;

import com.buzz.mileage.application.qr.dto.VerifyQrResponse;
import com.buzz.mileage.domain.token.service.RedemptionTokenService;
import com.buzz.mileage.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * QR 검증 유스케이스 (가맹점 스캔 → 결제 확정 전 확인)
 * 토큰 상태를 바꾸지 않으므로 몇 번을 호출해도 결과가 같다
 */
@Service
@RequiredArgsConstructor
public class VerifyQrUseCase {

    private final RedemptionTokenService redemptionTokenService;

    @Trace
    public VerifyQrResponse execute(String payload) {
        return VerifyQrResponse.from(redemptionTokenService.verify(payload));
    }
}
