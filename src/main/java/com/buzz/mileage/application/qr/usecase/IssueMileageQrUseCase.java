package com.buzz.mileage.application.qr.usecase;

import com.buzz.mileage.application.qr.dto.QrTokenResponse;
import com.buzz.mileage.application.qr.service.QrIssueService;
import com.buzz.mileage.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 마일리지 사용 QR 발급 유스케이스
 */
@Service
@RequiredArgsConstructor
public class IssueMileageQrUseCase {

    private final QrIssueService qrIssueService;

    @Trace
    public QrTokenResponse execute(String accountId) {
        return QrTokenResponse.from(qrIssueService.issueMileage(accountId));
    }
}
