package com.buzz.mileage.presentation.controller.signup;

import com.buzz.mileage.application.signup.dto.SignupCommand;
import com.buzz.mileage.application.signup.dto.SignupRequest;
import com.buzz.mileage.application.signup.dto.SignupResponse;
import com.buzz.mileage.application.signup.usecase.SignupUseCase;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 회원 가입 API
 */
@Tag(name = "회원 가입", description = "가입 보너스 / 추천 가입 API")
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/accounts")
public class SignupController {

    private static final String FORWARDED_FOR = "X-Forwarded-For";

    private final SignupUseCase signupUseCase;

    /**
     * 회원 가입
     * POST /api/accounts/signup
     */
    @Operation(summary = "회원 가입", description = "위험도 평가 후 계정을 만들고 가입/추천/이벤트 보너스를 적립합니다")
    @PostMapping("/signup")
    public ResponseEntity<SignupResponse> signup(@Valid @RequestBody SignupRequest request,
                                                 HttpServletRequest httpRequest) {
        SignupCommand command = SignupCommand.of(request, clientIp(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT));
        SignupResponse response = signupUseCase.execute(command);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    private static String clientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
