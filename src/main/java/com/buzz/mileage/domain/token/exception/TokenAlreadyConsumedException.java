package com.buzz.mileage.domain.token.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

/**
 * 다른 요청이 먼저 같은 토큰을 사용한 경우 (경합 패배)
 * 잔액 부족 같은 업무 오류와 구분하기 위해 CONCURRENCY_CONFLICT 로 분류된다
 */
public class TokenAlreadyConsumedException extends BusinessException {

    public TokenAlreadyConsumedException(String tokenId) {
        super(ErrorCode.Q004, String.format("이미 사용된 QR 코드입니다. tokenId: %s", tokenId));
    }

    public TokenAlreadyConsumedException(String tokenId, Throwable cause) {
        super(ErrorCode.Q004, String.format("이미 사용된 QR 코드입니다. tokenId: %s", tokenId), cause);
    }
}
