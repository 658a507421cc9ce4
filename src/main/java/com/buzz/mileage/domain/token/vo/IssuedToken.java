package com.buzz.mileage.domain.token.vo;

import com.buzz.mileage.domain.token.entity.TokenKind;
import java.time.LocalDateTime;

public record IssuedToken(
        String tokenId,
        String accountId,
        TokenKind kind,
        String referenceId,
        String payload,
        LocalDateTime issuedAt,
        LocalDateTime expiresAt
) {
}
