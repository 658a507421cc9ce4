package com.buzz.mileage.domain.account.repository;

import com.buzz.mileage.domain.account.entity.Account;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * 계정 Repository
 * 잔액 변경은 원자적 UPDATE 로만 수행한다 (read-modify-write 금지)
 */
public interface AccountRepository extends JpaRepository<Account, String> {

    Optional<Account> findByReferralCode(String referralCode);

    boolean existsByEmail(String email);

    boolean existsByPhone(String phone);

    boolean existsByReferralCode(String referralCode);

    /**
     * 추천인 조회 (비관적 락)
     * 추천 횟수 집계와 추천 기록 저장 사이에 다른 가입이 끼어들지 못하게 한다
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Account a WHERE a.referralCode = :referralCode")
    Optional<Account> findByReferralCodeWithLock(@Param("referralCode") String referralCode);

    /**
     * 현재 잔액 조회 (영속성 컨텍스트를 거치지 않는 최신 값)
     */
    @Query("SELECT a.balance.amount FROM Account a WHERE a.accountId = :accountId")
    Optional<Long> findBalanceByAccountId(@Param("accountId") String accountId);

    /**
     * 잔액 증가
     * @return 업데이트된 행 수 (0 이면 계정 없음)
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Account a SET a.balance.amount = a.balance.amount + :amount WHERE a.accountId = :accountId")
    int increaseBalance(@Param("accountId") String accountId, @Param("amount") long amount);

    /**
     * 잔액 차감 (compare-and-set)
     * 잔액이 부족하면 조건이 맞지 않아 0 을 반환한다
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Account a SET a.balance.amount = a.balance.amount - :amount " +
           "WHERE a.accountId = :accountId AND a.balance.amount >= :amount")
    int decreaseBalance(@Param("accountId") String accountId, @Param("amount") long amount);
}
