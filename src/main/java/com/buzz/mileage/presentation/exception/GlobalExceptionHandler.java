package com.buzz.mileage.presentation.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCategory;
import com.buzz.mileage.domain.common.exception.ErrorCode;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 전역 예외 처리 핸들러
 * 에러 분류(ErrorCategory)에 따라 HTTP 상태를 정한다
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 비즈니스 예외 처리
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException e) {
        HttpStatus status = statusOf(e.getCategory());
        if (status.is5xxServerError()) {
            log.error("비즈니스 예외 - code={}, message={}", e.getCode(), e.getMessage(), e);
        } else {
            log.info("비즈니스 예외 - code={}, message={}", e.getCode(), e.getMessage());
        }
        return ResponseEntity
            .status(status)
            .body(new ErrorResponse(e.getCode(), e.getMessage(), e.getCategory().isRetryable()));
    }

    /**
     * @RequestBody 검증 실패
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleMethodArgumentNotValid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(FieldError::getDefaultMessage)
            .orElse("입력값이 올바르지 않습니다");
        return badRequest(ErrorCode.COMMON001, message);
    }

    /**
     * Bean Validation 예외 처리 (@PathVariable, @RequestParam 검증 실패)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolationException(ConstraintViolationException e) {
        String message = e.getConstraintViolations().stream()
            .findFirst()
            .map(ConstraintViolation::getMessage)
            .orElse("입력값이 올바르지 않습니다");
        return badRequest(ErrorCode.COMMON001, message);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception e) {
        return badRequest(ErrorCode.COMMON002, ErrorCode.COMMON002.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException e) {
        return badRequest(ErrorCode.COMMON002, e.getMessage());
    }

    /**
     * 낙관적 락 충돌, 락 대기 실패, 유니크 제약 위반
     * 동시 요청 중 하나가 먼저 반영된 경우
     */
    @ExceptionHandler({ConcurrencyFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<ErrorResponse> handleConflict(RuntimeException e) {
        log.warn("동시성 충돌 - {}", e.getClass().getSimpleName());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ErrorResponse(ErrorCode.COMMON003.getCode(), ErrorCode.COMMON003.getMessage(), true));
    }

    /**
     * DB 연결 실패 등 일시적 저장소 장애
     */
    @ExceptionHandler(DataAccessResourceFailureException.class)
    public ResponseEntity<ErrorResponse> handleStorageUnavailable(DataAccessResourceFailureException e) {
        log.error("저장소 장애", e);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ErrorResponse(ErrorCode.COMMON005.getCode(), ErrorCode.COMMON005.getMessage(), true));
    }

    /**
     * 일반 예외 처리
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleException(Exception e) {
        log.error("처리되지 않은 예외", e);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ErrorResponse(ErrorCode.COMMON004.getCode(), "서버 내부 오류가 발생했습니다", false));
    }

    private static ResponseEntity<ErrorResponse> badRequest(ErrorCode errorCode, String message) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ErrorResponse(errorCode.getCode(), message, false));
    }

    private static HttpStatus statusOf(ErrorCategory category) {
        return switch (category) {
            case VALIDATION, BUSINESS_RULE -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FORBIDDEN -> HttpStatus.FORBIDDEN;
            case CONCURRENCY_CONFLICT -> HttpStatus.CONFLICT;
            case INFRASTRUCTURE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
