package com.buzz.mileage.domain.risk.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 기기 지문 해시 = SHA-256(User-Agent | 클라이언트 지문)
 */
public final class DeviceFingerprintHasher {

    private DeviceFingerprintHasher() {
    }

    public static String hash(String userAgent, String clientFingerprint) {
        String source = nullToEmpty(userAgent) + "|" + nullToEmpty(clientFingerprint);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(source.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 을 사용할 수 없습니다", e);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
