package com.buzz.mileage.application.coupon.dto;

import com.buzz.mileage.domain.coupon.entity.CouponKind;
import com.buzz.mileage.domain.coupon.entity.DiscountMode;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.LocalDateTime;

/**
 * 쿠폰 지급 요청 DTO (관리자)
 */
public record IssueCouponRequest(
        @Schema(description = "쿠폰 이름", example = "지역 상권 살리기 10,000원 할인")
        @NotBlank(message = "쿠폰 이름은 필수입니다")
        @Size(max = 100, message = "쿠폰 이름은 100자 이하여야 합니다")
        String name,

        @Schema(description = "쿠폰 종류 (EVENT 는 정부 지원금 대상)", example = "EVENT")
        @NotNull(message = "쿠폰 종류는 필수입니다")
        CouponKind kind,

        @Schema(description = "할인 방식", example = "AMOUNT")
        @NotNull(message = "할인 방식은 필수입니다")
        DiscountMode discountMode,

        @Schema(description = "할인 값 (정액: 원, 정률: %)", example = "10000")
        @NotNull(message = "할인 값은 필수입니다")
        @Min(value = 1, message = "할인 값은 1 이상이어야 합니다")
        Long discountValue,

        @Schema(description = "만료 일시 (없으면 무기한)", example = "2025-12-31T23:59:59")
        LocalDateTime expiresAt
) {
}
