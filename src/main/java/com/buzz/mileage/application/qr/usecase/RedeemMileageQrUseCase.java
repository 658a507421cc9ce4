package com.buzz.mileage.application.qr.usecase;

import com.buzz.mileage.application.qr.dto.RedeemMileageQrRequest;
import com.buzz.mileage.application.qr.dto.RedeemMileageQrResponse;
import com.buzz.mileage.application.qr.service.QrRedeemService;
import com.buzz.mileage.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 마일리지 QR 사용 유스케이스
 *
 * 분산 락 없이 저장소의 조건부 UPDATE 와 유니크 제약으로 단일 사용을 보장한다.
 * 트랜잭션이 롤백된 뒤에 경합 패배를 TokenAlreadyConsumedException 으로 바꾼다.
 */
@Service
@RequiredArgsConstructor
public class RedeemMileageQrUseCase {

    private final QrRedeemService qrRedeemService;
    private final RedeemRaceTranslator redeemRaceTranslator;

    @Trace
    public RedeemMileageQrResponse execute(RedeemMileageQrRequest request) {
        return redeemRaceTranslator.translate(request.payload(),
                () -> qrRedeemService.redeemMileage(request.payload(), request.merchantId(), request.amount()));
    }
}
