package com.buzz.mileage.application.mileage.usecase;

import com.buzz.mileage.application.mileage.dto.MileageBalanceResponse;
import com.buzz.mileage.domain.ledger.service.MileageLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 마일리지 잔액 조회 유스케이스
 */
@Service
@RequiredArgsConstructor
public class GetMileageBalanceUseCase {

    private final MileageLedger mileageLedger;

    public MileageBalanceResponse execute(String accountId) {
        return new MileageBalanceResponse(accountId, mileageLedger.balanceOf(accountId));
    }
}
