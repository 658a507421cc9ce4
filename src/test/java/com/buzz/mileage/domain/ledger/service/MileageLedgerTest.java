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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("마일리지 원장 테스트")
class MileageLedgerTest {

    private static final String ACCOUNT_ID = "A-001";
    private static final LedgerReference REFERENCE = LedgerReference.of(LedgerReferenceType.QR_REDEEM, "T-001");

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private LedgerEntryRepository ledgerEntryRepository;

    private MileageLedger mileageLedger;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T03:00:00Z"), ZoneId.of("Asia/Seoul"));
        mileageLedger = new MileageLedger(accountRepository, ledgerEntryRepository, clock);
    }

    @Test
    @DisplayName("적립하면 잔액을 원자적으로 올리고 적립 후 잔액을 담은 항목을 추가한다")
    void 적립() {
        // given
        given(accountRepository.increaseBalance(ACCOUNT_ID, 1_000L)).willReturn(1);
        given(accountRepository.findBalanceByAccountId(ACCOUNT_ID)).willReturn(Optional.of(1_500L));
        given(ledgerEntryRepository.save(any(LedgerEntry.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        LedgerEntry entry = mileageLedger.credit(ACCOUNT_ID, 1_000L, LedgerCategory.EARN, "가입 보너스",
                LedgerReference.of(LedgerReferenceType.SIGNUP, ACCOUNT_ID));

        // then
        assertThat(entry.getAmount()).isEqualTo(1_000L);
        assertThat(entry.getBalanceAfter()).isEqualTo(1_500L);
        assertThat(entry.getReferenceType()).isEqualTo(LedgerReferenceType.SIGNUP);
        assertThat(entry.isCredit()).isTrue();
    }

    @Test
    @DisplayName("차감 항목은 음수 금액으로 기록된다")
    void 차감() {
        // given
        given(accountRepository.decreaseBalance(ACCOUNT_ID, 700L)).willReturn(1);
        given(accountRepository.findBalanceByAccountId(ACCOUNT_ID)).willReturn(Optional.of(300L));
        given(ledgerEntryRepository.save(any(LedgerEntry.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        LedgerEntry entry = mileageLedger.debit(ACCOUNT_ID, 700L, LedgerCategory.SPEND, "가맹점 사용", REFERENCE);

        // then
        assertThat(entry.getAmount()).isEqualTo(-700L);
        assertThat(entry.getBalanceAfter()).isEqualTo(300L);
        assertThat(entry.getReferenceId()).isEqualTo("T-001");
    }

    @Test
    @DisplayName("잔액이 부족하면 원장 항목 없이 예외가 발생한다")
    void 잔액_부족() {
        // given
        given(accountRepository.decreaseBalance(ACCOUNT_ID, 5_000L)).willReturn(0);
        given(accountRepository.findBalanceByAccountId(ACCOUNT_ID)).willReturn(Optional.of(4_999L));

        // when & then
        assertThatThrownBy(() -> mileageLedger.debit(ACCOUNT_ID, 5_000L, LedgerCategory.SPEND, "가맹점 사용", REFERENCE))
                .isInstanceOf(InsufficientBalanceException.class)
                .hasMessageContaining("4999");
        verify(ledgerEntryRepository, never()).save(any());
    }

    @Test
    @DisplayName("존재하지 않는 계정에는 적립할 수 없다")
    void 계정_없음() {
        // given
        given(accountRepository.increaseBalance("A-404", 1_000L)).willReturn(0);

        // when & then
        assertThatThrownBy(() -> mileageLedger.credit("A-404", 1_000L, LedgerCategory.EARN, "보너스", REFERENCE))
                .isInstanceOf(AccountNotFoundException.class);
    }

    @Test
    @DisplayName("0원 이하 금액은 저장소를 호출하지 않고 거부된다")
    void 잘못된_금액() {
        assertThatThrownBy(() -> mileageLedger.credit(ACCOUNT_ID, 0L, LedgerCategory.EARN, "보너스", REFERENCE))
                .isInstanceOf(InvalidLedgerAmountException.class);
        assertThatThrownBy(() -> mileageLedger.debit(ACCOUNT_ID, -10L, LedgerCategory.SPEND, "사용", REFERENCE))
                .isInstanceOf(InvalidLedgerAmountException.class);

        verify(accountRepository, never()).increaseBalance(any(), anyLong());
        verify(accountRepository, never()).decreaseBalance(any(), anyLong());
    }

    @Test
    @DisplayName("관리자 음수 조정은 ADMIN_ADJUST 차감으로 기록된다")
    void 관리자_차감_조정() {
        // given
        given(accountRepository.decreaseBalance(ACCOUNT_ID, 200L)).willReturn(1);
        given(accountRepository.findBalanceByAccountId(ACCOUNT_ID)).willReturn(Optional.of(800L));
        given(ledgerEntryRepository.save(any(LedgerEntry.class))).willAnswer(invocation -> invocation.getArgument(0));

        // when
        LedgerEntry entry = mileageLedger.adjustAdmin(ACCOUNT_ID, -200L, "오적립 회수", "ADMIN-1");

        // then
        assertThat(entry.getAmount()).isEqualTo(-200L);
        assertThat(entry.getCategory()).isEqualTo(LedgerCategory.ADMIN_ADJUST);
        assertThat(entry.getReferenceType()).isEqualTo(LedgerReferenceType.ADMIN);
        assertThat(entry.getReferenceId()).isEqualTo("ADMIN-1");
    }

    @Test
    @DisplayName("0원 조정은 거부된다")
    void 영원_조정() {
        assertThatThrownBy(() -> mileageLedger.adjustAdmin(ACCOUNT_ID, 0L, "무의미", "ADMIN-1"))
                .isInstanceOf(InvalidLedgerAmountException.class);
    }
}
