package com.buzz.mileage.domain.risk.entity;

import com.buzz.mileage.infrastructure.jpa.BaseEntity;
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
 * 차단 IP
 */
@Entity
@Table(name = "ip_blacklist",
        uniqueConstraints = @UniqueConstraint(name = "uk_ip_blacklist_ip", columnNames = "ip_address"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class IpBlacklistEntry extends BaseEntity {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "ip_address", nullable = false, length = 64)
    private String ipAddress;

    @Column
    private String reason;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "expires_at")
    private LocalDateTime expiresAt;    // null 이면 영구 차단
}
