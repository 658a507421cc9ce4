package com.buzz.mileage.domain.ledger.service;

import com.buzz.mileage.domain.account.exception.AccountNotFoundException;
import com.buzz.mileage.domain.account.repository.AccountRepository;
import com.buzz.mileage.domain.ledger.entity.LedgerCategory;
import com.buzz.mileage.domain.ledger.entity.LedgerEntry;
import com.buzz.mileage.domain.ledger.entity.LedgerReferenceType;
import com.buzz.mileage.domain.ledger.exception.InsufficientBalanceException;
import com.buzz.mileage.domain.ledger.exception.InvalidLedgerAmountException;
import com.buzz.mileage.domain.ledger.repository.LedgerEntryRepository;
import com.buzz.mileage.domain.ledger.vo.LedgerReference;
import java.time.Clock;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 마일리지 원장
 *
 * 잔액 변경의 유일한 통로. 항목 추가와 잔액 캐시 갱신을 같은 트랜잭션에서 수행한다.
 * - 적립: 원자적 UPDATE (balance = balance + :amount)
 * - 차감: 조건부 UPDATE (balance >= :amount) 로 잔액 확인과 쓰기를 한 문장에서 처리
 * 따라서 두 차감이 동시에 "충분한 잔액"을 읽고 초과 인출하는 일이 없다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MileageLedger {

    private final AccountRepository accountRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final Clock clock;

    @Transactional
    public LedgerEntry credit(String accountId, long amount, LedgerCategory category,
                              String description, LedgerReference reference) {
        requirePositive(amount);

        int updated = accountRepository.increaseBalance(accountId, amount);
        if (updated == 0) {
            throw new AccountNotFoundException(accountId);
        }

        LedgerEntry entry = append(accountId, amount, category, description, reference);
        log.debug("마일리지 적립 - accountId={}, amount={}, ref={}:{}, balanceAfter={}",
                accountId, amount, reference.type(), reference.id(), entry.getBalanceAfter());
        return entry;
    }

    /**
     * @throws InsufficientBalanceException 잔액보다 큰 금액을 차감하려는 경우 (원장은 변경되지 않음)
     */
    @Transactional
    public LedgerEntry debit(String accountId, long amount, LedgerCategory category,
                             String description, LedgerReference reference) {
        requirePositive(amount);

        int updated = accountRepository.decreaseBalance(accountId, amount);
        if (updated == 0) {
            long current = accountRepository.findBalanceByAccountId(accountId)
                    .orElseThrow(() -> new AccountNotFoundException(accountId));
            throw new InsufficientBalanceException(amount, current);
        }

        LedgerEntry entry = append(accountId, -amount, category, description, reference);
        log.debug("마일리지 차감 - accountId={}, amount={}, ref={}:{}, balanceAfter={}",
                accountId, amount, reference.type(), reference.id(), entry.getBalanceAfter());
        return entry;
    }

    /**
     * 관리자 조정. 음수 조정도 일반 차감과 같은 잔액 검증을 거친다.
     */
    @Transactional
    public LedgerEntry adjustAdmin(String accountId, long signedAmount, String description, String adminId) {
        if (signedAmount == 0) {
            throw new InvalidLedgerAmountException(signedAmount);
        }

        LedgerReference reference = LedgerReference.of(LedgerReferenceType.ADMIN, adminId);
        LedgerEntry entry = signedAmount > 0
                ? credit(accountId, signedAmount, LedgerCategory.ADMIN_ADJUST, description, reference)
                : debit(accountId, -signedAmount, LedgerCategory.ADMIN_ADJUST, description, reference);

        log.info("관리자 마일리지 조정 - accountId={}, amount={}, adminId={}", accountId, signedAmount, adminId);
        return entry;
    }

    @Transactional(readOnly = true)
    public long balanceOf(String accountId) {
        return accountRepository.findBalanceByAccountId(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));
    }

    @Transactional(readOnly = true)
    public long sumOfEntries(String accountId) {
        return ledgerEntryRepository.sumAmountByAccountId(accountId);
    }

    @Transactional(readOnly = true)
    public Page<LedgerEntry> history(String accountId, LedgerCategory category, Pageable pageable) {
        if (category == null) {
            return ledgerEntryRepository.findByAccountIdOrderByCreatedAtDesc(accountId, pageable);
        }
        return ledgerEntryRepository.findByAccountIdAndCategoryOrderByCreatedAtDesc(accountId, category, pageable);
    }

    private LedgerEntry append(String accountId, long signedAmount, LedgerCategory category,
                               String description, LedgerReference reference) {
        long balanceAfter = accountRepository.findBalanceByAccountId(accountId)
                .orElseThrow(() -> new AccountNotFoundException(accountId));

        return ledgerEntryRepository.save(LedgerEntry.builder()
                .accountId(accountId)
                .amount(signedAmount)
                .category(category)
                .description(description)
                .referenceType(reference.type())
                .referenceId(reference.id())
                .balanceAfter(balanceAfter)
                .createdAt(LocalDateTime.now(clock))
                .build());
    }

    private static void requirePositive(long amount) {
        if (amount <= 0) {
            throw new InvalidLedgerAmountException(amount);
        }
    }
}
