package com.buzz.mileage.application.qr.usecase;

import com.buzz.mileage.application.qr.dto.QrTokenResponse;
import com.buzz.mileage.application.qr.service.QrIssueService;
import com.buzz.mileage.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 쿠폰 사용 QR 발급 유스케이스
 */
@Service
@RequiredArgsConstructor
public class IssueCouponQrUseCase {

    private final QrIssueService qrIssueService;

    @Trace
    public QrTokenResponse execute(String accountId, String couponId) {
        return QrTokenResponse.from(qrIssueService.issueCoupon(accountId, couponId));
    }
}
