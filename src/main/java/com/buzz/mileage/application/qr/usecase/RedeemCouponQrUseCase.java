package com.buzz.mileage.application.qr.usecase;

import com.buzz.mileage.application.qr.dto.RedeemCouponQrRequest;
import com.buzz.mileage.application.qr.dto.RedeemCouponQrResponse;
import com.buzz.mileage.application.qr.service.QrRedeemService;
import com.buzz.mileage.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 쿠폰 QR 사용 유스케이스
 */
@Service
@RequiredArgsConstructor
public class RedeemCouponQrUseCase {

    private final QrRedeemService qrRedeemService;
    private final RedeemRaceTranslator redeemRaceTranslator;

    @Trace
    public RedeemCouponQrResponse execute(RedeemCouponQrRequest request) {
        return redeemRaceTranslator.translate(request.payload(),
                () -> qrRedeemService.redeemCoupon(request.payload(), request.merchantId(), request.orderAmount()));
    }
}
