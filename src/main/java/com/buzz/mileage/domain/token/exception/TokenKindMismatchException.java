package com.buzz.mileage.domain.token.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;
import com.buzz.mileage.domain.token.entity.TokenKind;

public class TokenKindMismatchException extends BusinessException {

    public TokenKindMismatchException(TokenKind expected, TokenKind actual) {
        super(ErrorCode.Q005, String.format("QR 코드 종류가 일치하지 않습니다. 요청: %s, 토큰: %s", expected, actual));
    }
}
