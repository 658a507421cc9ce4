package com.buzz.mileage.application.mileage.usecase;

import com.buzz.mileage.application.mileage.dto.MileageHistoryResponse;
import com.buzz.mileage.domain.ledger.entity.LedgerCategory;
import com.buzz.mileage.domain.ledger.entity.LedgerEntry;
import com.buzz.mileage.domain.ledger.service.MileageLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

/**
 * 마일리지 내역 조회 유스케이스
 */
@Service
@RequiredArgsConstructor
public class GetMileageHistoryUseCase {

    private static final int MAX_PAGE_SIZE = 100;

    private final MileageLedger mileageLedger;

    /**
     * @param category null 이면 전체
     */
    public MileageHistoryResponse execute(String accountId, LedgerCategory category, int page, int size) {
        long balance = mileageLedger.balanceOf(accountId);
        PageRequest pageable = PageRequest.of(Math.max(page, 0), Math.min(Math.max(size, 1), MAX_PAGE_SIZE));
        Page<LedgerEntry> entries = mileageLedger.history(accountId, category, pageable);
        return MileageHistoryResponse.from(accountId, balance, entries);
    }
}
