package com.buzz.mileage.domain.token.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

public class TokenNotFoundException extends BusinessException {

    public TokenNotFoundException(String tokenId) {
        super(ErrorCode.Q002, String.format("QR 코드를 찾을 수 없습니다. tokenId: %s", tokenId));
    }
}
