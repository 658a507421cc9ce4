package com.buzz.mileage.common.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * QR 토큰 설정 (buzz.qr.*)
 */
@Data
@Validated
@ConfigurationProperties(prefix = "buzz.qr")
public class QrTokenProperties {

    /**
     * HMAC-SHA256 서명 키 (최소 256bit)
     */
    @NotBlank
    @Size(min = 32)
    private String secret;

    @NotNull
    private Duration tokenTtl = Duration.ofMinutes(10);

    /**
     * 미사용 만료 토큰 보관 일수
     */
    @Min(1)
    private int retentionDays = 30;

    @NotBlank
    private String payloadPrefix = "BUZZ";
}
