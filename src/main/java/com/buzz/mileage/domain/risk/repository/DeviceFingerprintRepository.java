package com.buzz.mileage.domain.risk.repository;

import com.buzz.mileage.domain.risk.entity.DeviceFingerprint;
import java.time.LocalDateTime;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DeviceFingerprintRepository extends JpaRepository<DeviceFingerprint, String> {

    Optional<DeviceFingerprint> findByFingerprintHash(String fingerprintHash);

    /**
     * 가입 시도 횟수 증가
     * @return 업데이트된 행 수 (0 이면 처음 보는 기기)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DeviceFingerprint d SET d.signupAttempts = d.signupAttempts + 1, " +
           "d.lastIpAddress = :ipAddress, d.lastAttemptAt = :now " +
           "WHERE d.fingerprintHash = :fingerprintHash")
    int increaseSignupAttempts(@Param("fingerprintHash") String fingerprintHash,
                               @Param("ipAddress") String ipAddress,
                               @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE DeviceFingerprint d SET d.successfulSignups = d.successfulSignups + 1 " +
           "WHERE d.fingerprintHash = :fingerprintHash")
    int increaseSuccessfulSignups(@Param("fingerprintHash") String fingerprintHash);
}
