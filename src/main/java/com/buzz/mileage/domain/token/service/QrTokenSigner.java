package com.buzz.mileage.domain.token.service;

import com.buzz.mileage.common.config.QrTokenProperties;
import com.buzz.mileage.domain.token.entity.TokenKind;
import com.buzz.mileage.domain.token.exception.InvalidTokenException;
import com.buzz.mileage.domain.token.vo.SignedToken;
import com.buzz.mileage.domain.token.vo.TokenClaims;
import com.buzz.mileage.domain.token.vo.VerificationFailure;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.HexFormat;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * QR 페이로드 서명/파싱
 *
 * 형식: {prefix}:{KIND}:{jws}
 * jws 는 HS256 으로 서명되며 tokenId, accountId, kind, referenceId, 발급/만료 시각, nonce 를 담는다.
 * 표준 exp 클레임은 쓰지 않는다. 만료 판정은 저장된 expiresAt 으로만 한다.
 */
@Slf4j
@Component
public class QrTokenSigner {

    private static final String CLAIM_TOKEN_ID = "tid";
    private static final String CLAIM_KIND = "kind";
    private static final String CLAIM_REFERENCE_ID = "ref";
    private static final String CLAIM_ISSUED_AT = "issuedAt";
    private static final String CLAIM_EXPIRES_AT = "expiresAt";
    private static final String SEPARATOR = ":";

    private final Key key;
    private final String prefix;

    public QrTokenSigner(QrTokenProperties properties) {
        this.key = Keys.hmacShaKeyFor(properties.getSecret().getBytes(StandardCharsets.UTF_8));
        this.prefix = properties.getPayloadPrefix();
    }

    public SignedToken sign(TokenClaims claims) {
        String jws = Jwts.builder()
                .setId(claims.nonce())
                .setSubject(claims.accountId())
                .claim(CLAIM_TOKEN_ID, claims.tokenId())
                .claim(CLAIM_KIND, claims.kind().name())
                .claim(CLAIM_REFERENCE_ID, claims.referenceId())
                .claim(CLAIM_ISSUED_AT, claims.issuedAt().toString())
                .claim(CLAIM_EXPIRES_AT, claims.expiresAt().toString())
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();

        String payload = prefix + SEPARATOR + claims.kind().name() + SEPARATOR + jws;
        return new SignedToken(payload, hash(jws));
    }

    /**
     * @throws InvalidTokenException 형식 오류(MALFORMED) 또는 서명 불일치(INVALID_SIGNATURE)
     */
    public TokenClaims parse(String payload) {
        String[] parts = splitPayload(payload);
        TokenKind outerKind = parseKind(parts[1]);
        String jws = parts[2];

        Claims body;
        try {
            body = Jwts.parserBuilder()
                    .setSigningKey(key)
                    .build()
                    .parseClaimsJws(jws)
                    .getBody();
        } catch (MalformedJwtException e) {
            throw new InvalidTokenException(VerificationFailure.MALFORMED, "QR 페이로드 형식이 올바르지 않습니다", e);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("QR 서명 검증 실패 - reason={}", e.getMessage());
            throw new InvalidTokenException(VerificationFailure.INVALID_SIGNATURE, "QR 서명이 유효하지 않습니다", e);
        }

        TokenClaims claims = toClaims(body);
        if (claims.kind() != outerKind) {
            throw new InvalidTokenException(VerificationFailure.INVALID_SIGNATURE, "QR 종류가 서명 내용과 다릅니다");
        }
        return claims;
    }

    /**
     * 저장용 해시는 페이로드의 jws 부분 기준
     */
    public String hashOf(String payload) {
        return hash(splitPayload(payload)[2]);
    }

    private String[] splitPayload(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new InvalidTokenException(VerificationFailure.MALFORMED, "QR 페이로드가 비어 있습니다");
        }
        String[] parts = payload.trim().split(SEPARATOR, 3);
        if (parts.length != 3 || !prefix.equals(parts[0]) || parts[2].isBlank()) {
            throw new InvalidTokenException(VerificationFailure.MALFORMED, "QR 페이로드 형식이 올바르지 않습니다");
        }
        return parts;
    }

    private TokenKind parseKind(String value) {
        try {
            return TokenKind.valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidTokenException(VerificationFailure.MALFORMED, "알 수 없는 QR 종류입니다: " + value, e);
        }
    }

    private TokenClaims toClaims(Claims body) {
        try {
            return new TokenClaims(
                    requireClaim(body, CLAIM_TOKEN_ID),
                    requireClaim(body, Claims.SUBJECT),
                    TokenKind.valueOf(requireClaim(body, CLAIM_KIND)),
                    body.get(CLAIM_REFERENCE_ID, String.class),
                    LocalDateTime.parse(requireClaim(body, CLAIM_ISSUED_AT)),
                    LocalDateTime.parse(requireClaim(body, CLAIM_EXPIRES_AT)),
                    body.getId());
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new InvalidTokenException(VerificationFailure.MALFORMED, "QR 클레임이 올바르지 않습니다", e);
        }
    }

    private static String requireClaim(Claims body, String name) {
        String value = body.get(name, String.class);
        if (value == null) {
            throw new IllegalArgumentException("클레임 누락: " + name);
        }
        return value;
    }

    private static String hash(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 을 사용할 수 없습니다", e);
        }
    }
}
