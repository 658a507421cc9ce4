package com.buzz.mileage.domain.common.exception;

/**
 * 같은 키로 진행 중인 요청이 있어 락을 얻지 못한 경우
 */
public class ConcurrentRequestException extends BusinessException {

    public ConcurrentRequestException(String lockKey) {
        super(ErrorCode.L001, String.format("요청이 처리 중입니다. 잠시 후 다시 시도해주세요 (key=%s)", lockKey));
    }
}
