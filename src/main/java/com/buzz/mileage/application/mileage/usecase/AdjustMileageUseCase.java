package com.buzz.mileage.application.mileage.usecase;

import com.buzz.mileage.application.mileage.dto.AdjustMileageRequest;
import com.buzz.mileage.application.mileage.dto.AdjustMileageResponse;
import com.buzz.mileage.domain.ledger.service.MileageLedger;
import com.buzz.mileage.infrastructure.aop.annotation.DistributedLock;
import com.buzz.mileage.infrastructure.aop.annotation.Trace;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * 관리자 마일리지 조정 유스케이스
 *
 * 차감 조정도 일반 차감과 같은 잔액 검증을 거친다.
 * 같은 계정의 조정 요청은 분산 락(lock:mileage:{accountId})으로 직렬화한다.
 */
@Service
@RequiredArgsConstructor
public class AdjustMileageUseCase {

    private final MileageLedger mileageLedger;

    @Trace
    @DistributedLock(key = "'mileage:'.concat(#accountId)")
    public AdjustMileageResponse execute(String accountId, AdjustMileageRequest request) {
        return AdjustMileageResponse.from(
                mileageLedger.adjustAdmin(accountId, request.amount(), request.description(), request.adminId()));
    }
}
