package com.buzz.mileage.domain.common.exception;

import static com.buzz.mileage.domain.common.exception.ErrorCategory.BUSINESS_RULE;
import static com.buzz.mileage.domain.common.exception.ErrorCategory.CONCURRENCY_CONFLICT;
import static com.buzz.mileage.domain.common.exception.ErrorCategory.FORBIDDEN;
import static com.buzz.mileage.domain.common.exception.ErrorCategory.INFRASTRUCTURE;
import static com.buzz.mileage.domain.common.exception.ErrorCategory.NOT_FOUND;
import static com.buzz.mileage.domain.common.exception.ErrorCategory.VALIDATION;

/**
 * 에러 코드 정의
 */
public enum ErrorCode {
    // 계정 관련 에러
    A001("A001", "계정을 찾을 수 없습니다", NOT_FOUND),
    A002("A002", "이미 가입된 이메일입니다", BUSINESS_RULE),
    A003("A003", "이미 사용 중인 전화번호입니다", BUSINESS_RULE),
    A004("A004", "비활성화된 계정입니다", BUSINESS_RULE),

    // 마일리지 관련 에러
    M001("M001", "마일리지 잔액이 부족합니다", BUSINESS_RULE),
    M002("M002", "유효하지 않은 마일리지 금액입니다", VALIDATION),

    // QR 토큰 관련 에러
    Q001("Q001", "잘못된 QR 코드 형식입니다", VALIDATION),
    Q002("Q002", "QR 코드를 찾을 수 없습니다", NOT_FOUND),
    Q003("Q003", "만료된 QR 코드입니다", BUSINESS_RULE),
    Q004("Q004", "이미 사용된 QR 코드입니다", CONCURRENCY_CONFLICT),
    Q005("Q005", "QR 코드 종류가 요청과 일치하지 않습니다", VALIDATION),

    // 쿠폰 관련 에러
    C001("C001", "쿠폰을 찾을 수 없습니다", NOT_FOUND),
    C002("C002", "유효하지 않은 쿠폰입니다", VALIDATION),
    C003("C003", "만료된 쿠폰입니다", BUSINESS_RULE),
    C004("C004", "이미 사용된 쿠폰입니다", BUSINESS_RULE),

    // 정산 관련 에러
    S001("S001", "정산 내역을 찾을 수 없습니다", NOT_FOUND),
    S002("S002", "허용되지 않은 정산 상태 변경입니다", BUSINESS_RULE),
    S003("S003", "반려 사유는 필수입니다", VALIDATION),

    // 추천 관련 에러
    R001("R001", "본인의 추천 코드는 사용할 수 없습니다", BUSINESS_RULE),
    R002("R002", "추천인의 추천 한도를 초과했습니다", BUSINESS_RULE),

    // 가입 위험도 관련 에러
    K001("K001", "보안 정책에 의해 가입이 차단되었습니다", FORBIDDEN),

    // 분산 락
    L001("L001", "요청이 처리 중입니다. 잠시 후 다시 시도해주세요", CONCURRENCY_CONFLICT),

    // 공통 에러
    COMMON001("COMMON001", "필수 파라미터가 누락되었습니다", VALIDATION),
    COMMON002("COMMON002", "잘못된 요청 형식입니다", VALIDATION),
    COMMON003("COMMON003", "처리 중 충돌이 발생했습니다. 다시 시도해 주세요", CONCURRENCY_CONFLICT),
    COMMON004("COMMON004", "서버 내부 오류가 발생했습니다", INFRASTRUCTURE),
    COMMON005("COMMON005", "일시적으로 저장소를 사용할 수 없습니다. 다시 시도해 주세요", INFRASTRUCTURE);

    private final String code;
    private final String message;
    private final ErrorCategory category;

    ErrorCode(String code, String message, ErrorCategory category) {
        this.code = code;
        this.message = message;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public ErrorCategory getCategory() {
        return category;
    }
}
