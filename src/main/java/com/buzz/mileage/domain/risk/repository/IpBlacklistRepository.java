package com.buzz.mileage.domain.risk.repository;

import com.buzz.mileage.domain.risk.entity.IpBlacklistEntry;
import java.time.LocalDateTime;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface IpBlacklistRepository extends JpaRepository<IpBlacklistEntry, String> {

    /**
     * 현재 유효한 차단 여부
     */
    @Query("SELECT COUNT(b) > 0 FROM IpBlacklistEntry b WHERE b.ipAddress = :ip AND b.active = true " +
           "AND (b.expiresAt IS NULL OR b.expiresAt > :now)")
    boolean isBlacklisted(@Param("ip") String ipAddress, @Param("now") LocalDateTime now);
}
