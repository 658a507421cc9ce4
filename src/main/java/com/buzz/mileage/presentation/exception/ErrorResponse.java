package com.buzz.mileage.presentation.exception;

/**
 * 에러 응답
 *
 * @param retryable 같은 요청을 다시 보내도 되는지 (경합 충돌, 일시적 저장소 장애)
 */
public record ErrorResponse(String code, String message, boolean retryable) {
}
