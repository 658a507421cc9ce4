package com.buzz.mileage.domain.ledger.repository;

import com.buzz.mileage.domain.ledger.entity.LedgerCategory;
import com.buzz.mileage.domain.ledger.entity.LedgerEntry;
import com.buzz.mileage.domain.ledger.entity.LedgerReferenceType;
import java.util.List;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * 원장 Repository (조회/추가만 사용)
 */
public interface LedgerEntryRepository extends JpaRepository<LedgerEntry, String> {

    /**
     * 계정의 원장 합계 - 잔액 캐시 검증용
     */
    @Query("SELECT COALESCE(SUM(e.amount), 0) FROM LedgerEntry e WHERE e.accountId = :accountId")
    long sumAmountByAccountId(@Param("accountId") String accountId);

    Page<LedgerEntry> findByAccountIdOrderByCreatedAtDesc(String accountId, Pageable pageable);

    Page<LedgerEntry> findByAccountIdAndCategoryOrderByCreatedAtDesc(
            String accountId, LedgerCategory category, Pageable pageable);

    List<LedgerEntry> findByAccountIdOrderByCreatedAtAsc(String accountId);

    List<LedgerEntry> findByReferenceTypeAndReferenceId(LedgerReferenceType referenceType, String referenceId);

    long countByAccountId(String accountId);
}
