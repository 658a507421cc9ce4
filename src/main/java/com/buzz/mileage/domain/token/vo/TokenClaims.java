package com.buzz.mileage.domain.token.vo;

import com.buzz.mileage.domain.token.entity.TokenKind;
import java.time.LocalDateTime;

/**
 * 서명 페이로드에 묶이는 값
 */
public record TokenClaims(
        String tokenId,
        String accountId,
        TokenKind kind,
        String referenceId,
        LocalDateTime issuedAt,
        LocalDateTime expiresAt,
        String nonce
) {
}
