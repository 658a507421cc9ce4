package com.buzz.mileage.domain.token.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;
import java.time.LocalDateTime;

public class TokenExpiredException extends BusinessException {

    public TokenExpiredException(String tokenId, LocalDateTime expiresAt) {
        super(ErrorCode.Q003, String.format("만료된 QR 코드입니다. tokenId: %s, expiresAt: %s", tokenId, expiresAt));
    }
}
