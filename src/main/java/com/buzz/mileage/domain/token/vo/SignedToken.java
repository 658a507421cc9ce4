package com.buzz.mileage.domain.token.vo;

/**
 * @param payload QR 에 담기는 문자열 ({prefix}:{KIND}:{jws})
 * @param tokenHash jws 의 SHA-256 (hex)
 */
public record SignedToken(String payload, String tokenHash) {
}
