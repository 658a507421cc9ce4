package com.buzz.mileage.application.qr.dto;

import com.buzz.mileage.domain.token.entity.TokenKind;
import com.buzz.mileage.domain.token.vo.IssuedToken;
import io.swagger.v3.oas.annotations.media.Schema;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * QR 발급 응답 DTO
 * payload 를 QR 이미지로 그리는 것은 클라이언트 몫이다
 */
public record QrTokenResponse(
        @Schema(description = "토큰 ID")
        String tokenId,

        @Schema(description = "토큰 종류", example = "MILEAGE")
        TokenKind kind,

        @Schema(description = "쿠폰 ID (쿠폰 QR 인 경우)")
        String couponId,

        @Schema(description = "QR 에 담을 서명된 페이로드", example = "BUZZ:MILEAGE:eyJhbGciOiJIUzI1NiJ9...")
        String payload,

        @Schema(description = "만료 일시", example = "2025-11-05T23:40:00")
        LocalDateTime expiresAt,

        @Schema(description = "유효 시간(초)", example = "600")
        long expiresInSeconds
) {
    public static QrTokenResponse from(IssuedToken token) {
        return new QrTokenResponse(
                token.tokenId(),
                token.kind(),
                token.referenceId(),
                token.payload(),
                token.expiresAt(),
                Duration.between(token.issuedAt(), token.expiresAt()).getSeconds()
        );
    }
}
