package com.buzz.mileage.domain.risk.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 기기 지문별 가입 이력
 * 시도/성공 횟수는 DeviceFingerprintRepository 의 원자적 UPDATE 로만 늘린다.
 * blocked 는 운영자가 지정하며 위험도 차단 결과로 자동 설정하지 않는다.
 */
@Entity
@Table(name = "device_fingerprints",
        uniqueConstraints = @UniqueConstraint(name = "uk_device_fingerprints_hash", columnNames = "fingerprint_hash"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class DeviceFingerprint {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "fingerprint_hash", nullable = false, length = 64)
    private String fingerprintHash;

    @Column(name = "last_ip_address", length = 64)
    private String lastIpAddress;

    @Column(name = "user_agent", length = 512)
    private String userAgent;

    @Column(name = "signup_attempts", nullable = false)
    private int signupAttempts;

    @Column(name = "successful_signups", nullable = false)
    private int successfulSignups;

    @Column(nullable = false)
    private boolean blocked;

    @Column(name = "blocked_reason")
    private String blockedReason;

    @Column(name = "last_attempt_at")
    private LocalDateTime lastAttemptAt;

    public static DeviceFingerprint firstSeen(String fingerprintHash, String ipAddress, String userAgent,
                                              LocalDateTime now) {
        return DeviceFingerprint.builder()
                .fingerprintHash(fingerprintHash)
                .lastIpAddress(ipAddress)
                .userAgent(userAgent)
                .signupAttempts(1)
                .successfulSignups(0)
                .blocked(false)
                .lastAttemptAt(now)
                .build();
    }
}
