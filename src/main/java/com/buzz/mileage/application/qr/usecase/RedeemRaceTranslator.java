package com.buzz.mileage.application.qr.usecase;

import com.buzz.mileage.domain.token.exception.TokenAlreadyConsumedException;
import com.buzz.mileage.domain.token.service.QrTokenSigner;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * QR 사용 경합 패배 변환
 *
 * 조건부 UPDATE 를 통과한 두 요청 중 하나는 정산 유니크 제약 또는 락 대기 실패로 끝난다.
 * 저장소 예외를 "이미 사용된 QR" 로 바꿔 업무 오류(잔액 부족 등)와 구분되게 한다.
 * 트랜잭션 밖에서 호출해야 한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
class RedeemRaceTranslator {

    private final QrTokenSigner qrTokenSigner;

    <T> T translate(String payload, Supplier<T> redeem) {
        try {
            return redeem.get();
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            String tokenId = qrTokenSigner.parse(payload).tokenId();
            log.warn("QR 사용 경합 패배 - tokenId={}, cause={}", tokenId, e.getClass().getSimpleName());
            throw new TokenAlreadyConsumedException(tokenId, e);
        }
    }
}
