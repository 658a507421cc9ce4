package com.buzz.mileage.domain.referral.exception;

import com.buzz.mileage.domain.common.exception.BusinessException;
import com.buzz.mileage.domain.common.exception.ErrorCode;

/**
 * 추천인이 윈도우 내 추천 한도를 채운 경우
 */
public class ReferralLimitExceededException extends BusinessException {

    public ReferralLimitExceededException(String referrerId, long count, int limit) {
        super(ErrorCode.R002,
              String.format("추천인의 추천 한도를 초과했습니다. referrerId: %s, 최근 추천: %d, 한도: %d", referrerId, count, limit));
    }
}
