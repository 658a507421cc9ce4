package com.buzz.mileage.application.signup.service;

import com.buzz.mileage.application.signup.dto.SignupCommand;
import com.buzz.mileage.application.signup.dto.SignupResult;
import com.buzz.mileage.common.config.MileagePolicyProperties;
import com.buzz.mileage.common.config.ReferralLimitPolicy;
import com.buzz.mileage.domain.account.entity.Account;
import com.buzz.mileage.domain.account.exception.DuplicateAccountException;
import com.buzz.mileage.domain.account.repository.AccountRepository;
import com.buzz.mileage.domain.account.vo.MileageBalance;
import com.buzz.mileage.domain.bonus.service.BonusCalculator;
import com.buzz.mileage.domain.ledger.entity.LedgerCategory;
import com.buzz.mileage.domain.ledger.entity.LedgerReferenceType;
import com.buzz.mileage.domain.ledger.service.MileageLedger;
import com.buzz.mileage.domain.ledger.vo.LedgerReference;
import com.buzz.mileage.domain.promotion.service.PromotionEventRegistry;
import com.buzz.mileage.domain.referral.entity.ReferralLink;
import com.buzz.mileage.domain.referral.exception.ReferralLimitExceededException;
import com.buzz.mileage.domain.referral.exception.SelfReferralException;
import com.buzz.mileage.domain.referral.repository.ReferralLinkRepository;
import com.buzz.mileage.domain.referral.service.ReferralCodeGenerator;
import com.buzz.mileage.infrastructure.kafka.notification.message.ReferralCompletedMessage;
import com.buzz.mileage.infrastructure.outbox.OutboxEventType;
import com.buzz.mileage.infrastructure.outbox.OutboxEventWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("회원 가입 서비스 테스트")
class SignupServiceTest {

    private static final String MY_CODE = "KIM3F9A1C";
    private static final String REFERRER_CODE = "LEE7B2D4E";

    @Mock
    private AccountRepository accountRepository;

    @Mock
    private ReferralLinkRepository referralLinkRepository;

    @Mock
    private ReferralCodeGenerator referralCodeGenerator;

    @Mock
    private PromotionEventRegistry promotionEventRegistry;

    @Mock
    private MileageLedger mileageLedger;

    @Mock
    private OutboxEventWriter outboxEventWriter;

    private MileagePolicyProperties policyProperties;
    private SignupService signupService;

    @BeforeEach
    void setUp() {
        policyProperties = new MileagePolicyProperties();
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T03:00:00Z"), ZoneId.of("Asia/Seoul"));
        signupService = new SignupService(accountRepository, referralLinkRepository, referralCodeGenerator,
                promotionEventRegistry, new BonusCalculator(), mileageLedger, outboxEventWriter,
                policyProperties, clock);
    }

    @Test
    @DisplayName("이미 가입된 이메일이면 계정을 만들지 않는다")
    void 이메일_중복() {
        // given
        given(accountRepository.existsByEmail("new@buzz.com")).willReturn(true);

        // when & then
        assertThatThrownBy(() -> signupService.signup(command(null)))
                .isInstanceOf(DuplicateAccountException.class);
        verify(accountRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("본인에게 발급될 추천 코드를 입력하면 거부되고 원장에 아무것도 남지 않는다")
    void 본인_추천_거부() {
        // given
        givenNewAccountCode();

        // when & then
        assertThatThrownBy(() -> signupService.signup(command(MY_CODE)))
                .isInstanceOf(SelfReferralException.class);
        verify(accountRepository, never()).saveAndFlush(any());
        verify(mileageLedger, never()).credit(anyString(), anyLong(), any(), anyString(), any());
    }

    @Test
    @DisplayName("추천 없이 가입하면 기본 가입 보너스만 적립된다")
    void 추천_없는_가입() {
        // given
        givenNewAccountCode();
        givenAccountSaved("A-NEW");
        given(mileageLedger.balanceOf("A-NEW")).willReturn(1_000L);

        // when
        SignupResult result = signupService.signup(command(null));

        // then
        assertThat(result.referrerId()).isNull();
        assertThat(result.signupBonus()).isEqualTo(1_000L);
        assertThat(result.referralCode()).isEqualTo(MY_CODE);
        verify(mileageLedger).credit(eq("A-NEW"), eq(1_000L), eq(LedgerCategory.EARN), anyString(),
                eq(LedgerReference.of(LedgerReferenceType.SIGNUP, "A-NEW")));
        verify(outboxEventWriter, never()).append(any(), anyString(), any());
    }

    @Test
    @DisplayName("추천 가입이면 양쪽에 보너스를 적립하고 추천 기록과 알림 이벤트를 남긴다")
    void 추천_가입() {
        // given
        givenNewAccountCode();
        givenAccountSaved("A-NEW");
        given(accountRepository.findByReferralCodeWithLock(REFERRER_CODE)).willReturn(Optional.of(referrer()));
        given(referralLinkRepository.countByReferrerIdAndCreatedAtAfter(eq("A-REF"), any())).willReturn(4L);
        given(referralLinkRepository.saveAndFlush(any(ReferralLink.class))).willAnswer(invocation -> {
            ReferralLink link = invocation.getArgument(0);
            ReflectionTestUtils.setField(link, "referralId", "R-001");
            return link;
        });
        given(mileageLedger.balanceOf("A-NEW")).willReturn(3_000L);

        // when
        SignupResult result = signupService.signup(command(REFERRER_CODE));

        // then
        assertThat(result.referrerId()).isEqualTo("A-REF");
        assertThat(result.signupBonus()).isEqualTo(3_000L);
        assertThat(result.referrerReward()).isEqualTo(500L);
        assertThat(result.referralIgnoredReason()).isNull();

        verify(mileageLedger).credit(eq("A-NEW"), eq(3_000L), eq(LedgerCategory.EARN), anyString(),
                eq(LedgerReference.of(LedgerReferenceType.REFERRAL, "A-REF")));
        verify(mileageLedger).credit(eq("A-REF"), eq(500L), eq(LedgerCategory.EARN), anyString(),
                eq(LedgerReference.of(LedgerReferenceType.REFERRAL, "A-NEW")));

        ArgumentCaptor<ReferralLink> linkCaptor = ArgumentCaptor.forClass(ReferralLink.class);
        verify(referralLinkRepository).saveAndFlush(linkCaptor.capture());
        assertThat(linkCaptor.getValue().getRewardAmount()).isEqualTo(500L);
        assertThat(linkCaptor.getValue().getSignupBonus()).isEqualTo(3_000L);

        verify(outboxEventWriter).append(eq(OutboxEventType.REFERRAL_COMPLETED), eq("R-001"),
                any(ReferralCompletedMessage.class));
    }

    @Test
    @DisplayName("알 수 없는 추천 코드는 가입을 막지 않고 추천 없이 처리한다")
    void 알수없는_추천코드() {
        // given
        givenNewAccountCode();
        givenAccountSaved("A-NEW");
        given(accountRepository.findByReferralCodeWithLock("NOPE00000")).willReturn(Optional.empty());
        given(mileageLedger.balanceOf("A-NEW")).willReturn(1_000L);

        // when
        SignupResult result = signupService.signup(command("NOPE00000"));

        // then
        assertThat(result.referrerId()).isNull();
        assertThat(result.signupBonus()).isEqualTo(1_000L);
        assertThat(result.referralIgnoredReason()).isNotBlank();
    }

    @Nested
    @DisplayName("추천 한도 초과")
    class ReferralLimit {

        @BeforeEach
        void givenReferrerAtLimit() {
            givenNewAccountCode();
            given(accountRepository.findByReferralCodeWithLock(REFERRER_CODE)).willReturn(Optional.of(referrer()));
            given(referralLinkRepository.countByReferrerIdAndCreatedAtAfter(eq("A-REF"), any())).willReturn(5L);
        }

        @Test
        @DisplayName("REJECT_SIGNUP 정책이면 가입 자체를 거부한다")
        void 가입_거부() {
            // when & then
            assertThatThrownBy(() -> signupService.signup(command(REFERRER_CODE)))
                    .isInstanceOf(ReferralLimitExceededException.class);
            verify(accountRepository, never()).saveAndFlush(any());
            verify(mileageLedger, never()).credit(anyString(), anyLong(), any(), anyString(), any());
        }

        @Test
        @DisplayName("SIGNUP_WITHOUT_REFERRAL 정책이면 추천 보상 없이 기본 보너스로 가입한다")
        void 추천_없이_가입() {
            // given
            policyProperties.setReferralLimitPolicy(ReferralLimitPolicy.SIGNUP_WITHOUT_REFERRAL);
            givenAccountSaved("A-NEW");
            given(mileageLedger.balanceOf("A-NEW")).willReturn(1_000L);

            // when
            SignupResult result = signupService.signup(command(REFERRER_CODE));

            // then
            assertThat(result.referrerId()).isNull();
            assertThat(result.signupBonus()).isEqualTo(1_000L);
            assertThat(result.referrerReward()).isZero();
            assertThat(result.referralIgnoredReason()).contains("한도");
            verify(mileageLedger, never()).credit(eq("A-REF"), anyLong(), any(), anyString(), any());
            verify(referralLinkRepository, never()).saveAndFlush(any());
        }
    }

    @Test
    @DisplayName("추천 코드 후보가 계속 충돌하면 대체 코드를 사용한다")
    void 추천코드_충돌() {
        // given
        given(accountRepository.existsByEmail("new@buzz.com")).willReturn(false);
        given(accountRepository.existsByPhone("010-1234-5678")).willReturn(false);
        given(referralCodeGenerator.generate("김버즈")).willReturn("KIMAAAAAA");
        given(accountRepository.existsByReferralCode("KIMAAAAAA")).willReturn(true);
        given(referralCodeGenerator.fallback()).willReturn("Z9Y8X7W6");
        givenAccountSaved("A-NEW");
        given(mileageLedger.balanceOf("A-NEW")).willReturn(1_000L);

        // when
        SignupResult result = signupService.signup(command(null));

        // then
        assertThat(result.referralCode()).isEqualTo("Z9Y8X7W6");
    }

    private void givenNewAccountCode() {
        given(accountRepository.existsByEmail("new@buzz.com")).willReturn(false);
        given(accountRepository.existsByPhone("010-1234-5678")).willReturn(false);
        given(referralCodeGenerator.generate("김버즈")).willReturn(MY_CODE);
        given(accountRepository.existsByReferralCode(MY_CODE)).willReturn(false);
    }

    private void givenAccountSaved(String accountId) {
        given(accountRepository.saveAndFlush(any(Account.class))).willAnswer(invocation -> {
            Account account = invocation.getArgument(0);
            ReflectionTestUtils.setField(account, "accountId", accountId);
            return account;
        });
    }

    private static Account referrer() {
        return Account.builder()
                .accountId("A-REF")
                .email("ref@buzz.com")
                .name("이추천")
                .referralCode(REFERRER_CODE)
                .balance(MileageBalance.zero())
                .active(true)
                .build();
    }

    private static SignupCommand command(String referralCode) {
        return new SignupCommand("new@buzz.com", "김버즈", "010-1234-5678", referralCode,
                "203.0.113.10", "Mozilla/5.0 (Macintosh)", "fp-1");
    }
}
