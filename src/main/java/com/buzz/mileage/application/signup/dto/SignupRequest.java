package com.buzz.mileage.application.signup.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * 회원 가입 요청 DTO
 */
public record SignupRequest(
        @Schema(description = "이메일", example = "buzz@example.com")
        @NotBlank(message = "이메일은 필수입니다")
        @Email(message = "이메일 형식이 올바르지 않습니다")
        String email,

        @Schema(description = "이름", example = "김버즈")
        @NotBlank(message = "이름은 필수입니다")
        @Size(max = 50, message = "이름은 50자 이하여야 합니다")
        String name,

        @Schema(description = "전화번호 (선택)", example = "010-1234-5678")
        @Pattern(regexp = "^01[0-9]-?\\d{3,4}-?\\d{4}$", message = "전화번호 형식이 올바르지 않습니다")
        String phone,

        @Schema(description = "추천 코드 (선택)", example = "KIM3F9A1C")
        @Size(max = 32, message = "추천 코드는 32자 이하여야 합니다")
        String referralCode,

        @Schema(description = "클라이언트 기기 지문 (선택)", example = "c0ffee-1920x1080-ko")
        @Size(max = 256, message = "기기 지문은 256자 이하여야 합니다")
        String deviceFingerprint
) {
}
