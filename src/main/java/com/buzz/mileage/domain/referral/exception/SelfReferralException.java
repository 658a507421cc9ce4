package com.buzz.mileage.domain.referral.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

public class SelfReferralException extends BusinessException {

    public SelfReferralException(String referralCode) {
        super(ErrorCode.R001, String.format("본인의 추천 코드는 사용할 수 없습니다. code: %s", referralCode));
    }
}
