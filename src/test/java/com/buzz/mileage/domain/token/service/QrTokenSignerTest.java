package com.buzz.mileage.domain.token.service;

import com.buzz.mileage.common.config.QrTokenProperties;
import com.buzz.mileage.domain.token.entity.TokenKind;
import com.buzz.mileage.domain.token.exception.InvalidTokenException;
import com.buzz.mileage.domain.token.vo.SignedToken;
import com.buzz.mileage.domain.token.vo.TokenClaims;
import com.buzz.mileage.domain.token.vo.VerificationFailure;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("QR 페이로드 서명 테스트")
class QrTokenSignerTest {

    private static final LocalDateTime ISSUED_AT = LocalDateTime.of(2025, 3, 1, 12, 0);

    private final QrTokenSigner signer = new QrTokenSigner(properties("test-qr-secret-0123456789-abcdefghijklmnop"));

    @Test
    @DisplayName("서명한 페이로드를 파싱하면 발급 정보가 그대로 나온다")
    void 서명_파싱() {
        // given
        TokenClaims claims = claims(TokenKind.COUPON, "C-001");

        // when
        SignedToken signed = signer.sign(claims);
        TokenClaims parsed = signer.parse(signed.payload());

        // then
        assertThat(signed.payload()).startsWith("BUZZ:COUPON:");
        assertThat(parsed).isEqualTo(claims);
        assertThat(signer.hashOf(signed.payload())).isEqualTo(signed.tokenHash());
    }

    @Test
    @DisplayName("같은 내용이라도 nonce 가 다르면 페이로드가 달라진다")
    void nonce_고유성() {
        // given
        TokenClaims first = claims(TokenKind.MILEAGE, null);
        TokenClaims second = new TokenClaims(first.tokenId(), first.accountId(), first.kind(), null,
                first.issuedAt(), first.expiresAt(), "nonce-2");

        // when & then
        assertThat(signer.sign(first).tokenHash()).isNotEqualTo(signer.sign(second).tokenHash());
    }

    @Test
    @DisplayName("다른 키로 서명한 페이로드는 INVALID_SIGNATURE")
    void 다른_키_서명() {
        // given
        QrTokenSigner forger = new QrTokenSigner(properties("forged-secret-forged-secret-forged-secret"));
        String payload = forger.sign(claims(TokenKind.MILEAGE, null)).payload();

        // when & then
        assertThatThrownBy(() -> signer.parse(payload))
                .isInstanceOfSatisfying(InvalidTokenException.class,
                        e -> assertThat(e.getFailure()).isEqualTo(VerificationFailure.INVALID_SIGNATURE));
    }

    @Test
    @DisplayName("겉으로 표시된 종류를 바꾸면 INVALID_SIGNATURE")
    void 종류_변조() {
        // given
        String payload = signer.sign(claims(TokenKind.MILEAGE, null)).payload();
        String tampered = payload.replaceFirst("BUZZ:MILEAGE:", "BUZZ:COUPON:");

        // when & then
        assertThatThrownBy(() -> signer.parse(tampered))
                .isInstanceOfSatisfying(InvalidTokenException.class,
                        e -> assertThat(e.getFailure()).isEqualTo(VerificationFailure.INVALID_SIGNATURE));
    }

    @Test
    @DisplayName("형식이 맞지 않는 페이로드는 MALFORMED")
    void 형식_오류() {
        assertMalformed(null);
        assertMalformed("  ");
        assertMalformed("OTHER:MILEAGE:abc.def.ghi");
        assertMalformed("BUZZ:POINT:abc.def.ghi");
        assertMalformed("BUZZ:MILEAGE:not-a-jws");
        assertMalformed("BUZZ:MILEAGE");
    }

    private void assertMalformed(String payload) {
        assertThatThrownBy(() -> signer.parse(payload))
                .isInstanceOfSatisfying(InvalidTokenException.class,
                        e -> assertThat(e.getFailure()).isEqualTo(VerificationFailure.MALFORMED));
    }

    private static TokenClaims claims(TokenKind kind, String referenceId) {
        return new TokenClaims("T-001", "A-001", kind, referenceId,
                ISSUED_AT, ISSUED_AT.plusMinutes(10), "nonce-1");
    }

    private static QrTokenProperties properties(String secret) {
        QrTokenProperties properties = new QrTokenProperties();
        properties.setSecret(secret);
        return properties;
    }
}
