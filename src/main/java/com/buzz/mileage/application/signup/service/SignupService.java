package com.buzz.mileage.application.signup.service;

import com.buzz.mileage.application.signup.dto.SignupCommand;
import com.buzz.mileage.application.signup.dto.SignupResult;
import com.buzz.mileage.common.config.MileagePolicyProperties;
import com.buzz.mileage.common.config.ReferralLimitPolicy;
import com.buzz.mileage.domain.account.entity.Account;
import com.buzz.mileage.domain.account.exception.DuplicateAccountException;
import com.buzz.mileage.domain.account.repository.AccountRepository;
import com.buzz.mileage.domain.bonus.service.BonusCalculator;
import com.buzz.mileage.domain.bonus.vo.Beneficiary;
import com.buzz.mileage.domain.bonus.vo.BonusContext;
import com.buzz.mileage.domain.bonus.vo.BonusCredit;
import com.buzz.mileage.domain.bonus.vo.BonusPlan;
import com.buzz.mileage.domain.ledger.entity.LedgerCategory;
import com.buzz.mileage.domain.ledger.service.MileageLedger;
import com.buzz.mileage.domain.ledger.vo.LedgerReference;
import com.buzz.mileage.domain.promotion.entity.PromotionEventType;
import com.buzz.mileage.domain.promotion.service.PromotionEventRegistry;
import com.buzz.mileage.domain.promotion.vo.ActivePromotion;
import com.buzz.mileage.domain.referral.entity.ReferralLink;
import com.buzz.mileage.domain.referral.entity.ReferralStatus;
import com.buzz.mileage.domain.referral.exception.ReferralLimitExceededException;
import com.buzz.mileage.domain.referral.exception.SelfReferralException;
import com.buzz.mileage.domain.referral.repository.ReferralLinkRepository;
import com.buzz.mileage.domain.referral.service.ReferralCodeGenerator;
import com.buzz.mileage.infrastructure.kafka.notification.message.ReferralCompletedMessage;
import com.buzz.mileage.infrastructure.outbox.OutboxEventType;
import com.buzz.mileage.infrastructure.outbox.OutboxEventWriter;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 회원 가입 트랜잭션 처리 서비스
 *
 * 처리 순서:
 * 1. 이메일/전화번호 중복 확인
 * 2. 추천 코드 발급 (충돌 시 재시도, 10회 실패하면 대체 코드)
 * 3. 본인 추천 차단 → 추천인 조회 (비관적 락) → 추천 한도 확인
 * 4. 계정 생성 → 보너스 계산 → 원장 적립
 * 5. 추천 기록 + 추천 완료 알림 (Outbox)
 *
 * 원장 적립 전에 모든 거절 조건을 확인하므로 거절된 가입은 원장에 흔적을 남기지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignupService {

    private static final int REFERRAL_CODE_MAX_ATTEMPTS = 10;

    private final AccountRepository accountRepository;
    private final ReferralLinkRepository referralLinkRepository;
    private final ReferralCodeGenerator referralCodeGenerator;
    private final PromotionEventRegistry promotionEventRegistry;
    private final BonusCalculator bonusCalculator;
    private final MileageLedger mileageLedger;
    private final OutboxEventWriter outboxEventWriter;
    private final MileagePolicyProperties policyProperties;
    private final Clock clock;

    @Transactional
    public SignupResult signup(SignupCommand command) {
        LocalDateTime now = LocalDateTime.now(clock);

        // 1. 중복 확인
        if (accountRepository.existsByEmail(command.email())) {
            throw DuplicateAccountException.email();
        }
        if (command.phone() != null && accountRepository.existsByPhone(command.phone())) {
            throw DuplicateAccountException.phone();
        }

        // 2. 추천 코드 발급
        String myReferralCode = issueReferralCode(command.name());

        // 3. 추천인 확인
        if (command.hasReferralCode() && command.referralCode().equals(myReferralCode)) {
            throw new SelfReferralException(command.referralCode());
        }
        ReferrerLookup lookup = findReferrer(command, now);

        // 4. 계정 생성 + 보너스 적립
        Account account = accountRepository.saveAndFlush(
                Account.open(command.email(), command.name(), command.phone(), myReferralCode));
        Account referrer = lookup.referrer();

        BonusPlan plan = bonusCalculator.compute(new BonusContext(
                policyProperties.toBonusPolicy(),
                account.getAccountId(),
                referrer == null ? null : referrer.getAccountId(),
                activeEvent(PromotionEventType.SIGNUP_BONUS, now),
                referrer == null ? null : activeEvent(PromotionEventType.REFERRAL_BONUS, now)));

        for (BonusCredit credit : plan.credits()) {
            String target = credit.beneficiary() == Beneficiary.REFEREE
                    ? account.getAccountId()
                    : referrer.getAccountId();
            mileageLedger.credit(target, credit.amount(), LedgerCategory.EARN, credit.description(),
                    LedgerReference.of(credit.referenceType(), credit.referenceId()));
        }

        // 5. 추천 기록
        if (referrer != null) {
            ReferralLink link = referralLinkRepository.saveAndFlush(ReferralLink.builder()
                    .referrerId(referrer.getAccountId())
                    .refereeId(account.getAccountId())
                    .referralCode(command.referralCode())
                    .rewardAmount(plan.totalFor(Beneficiary.REFERRER))
                    .signupBonus(plan.totalFor(Beneficiary.REFEREE))
                    .status(ReferralStatus.COMPLETED)
                    .createdAt(now)
                    .build());

            outboxEventWriter.append(OutboxEventType.REFERRAL_COMPLETED, link.getReferralId(),
                    ReferralCompletedMessage.from(link));
        }

        long balance = mileageLedger.balanceOf(account.getAccountId());
        log.info("회원 가입 완료 - accountId={}, referrerId={}, signupBonus={}, referrerReward={}",
                account.getAccountId(), referrer == null ? null : referrer.getAccountId(),
                plan.totalFor(Beneficiary.REFEREE), plan.totalFor(Beneficiary.REFERRER));

        return new SignupResult(
                account.getAccountId(),
                account.getEmail(),
                myReferralCode,
                referrer == null ? null : referrer.getAccountId(),
                plan.totalFor(Beneficiary.REFEREE),
                plan.totalFor(Beneficiary.REFERRER),
                balance,
                lookup.ignoredReason());
    }

    private String issueReferralCode(String name) {
        for (int i = 0; i < REFERRAL_CODE_MAX_ATTEMPTS; i++) {
            String candidate = referralCodeGenerator.generate(name);
            if (!accountRepository.existsByReferralCode(candidate)) {
                return candidate;
            }
        }
        log.warn("추천 코드 후보가 {}회 연속 충돌 - 대체 코드 사용", REFERRAL_CODE_MAX_ATTEMPTS);
        return referralCodeGenerator.fallback();
    }

    /**
     * 추천인 조회
     * 알 수 없거나 비활성인 코드는 추천 없이 가입시킨다. 한도 초과는 정책에 따른다.
     */
    private ReferrerLookup findReferrer(SignupCommand command, LocalDateTime now) {
        if (!command.hasReferralCode()) {
            return ReferrerLookup.none();
        }
        if (!policyProperties.isReferralEnabled()) {
            return ReferrerLookup.ignored("추천 프로그램이 중단되었습니다");
        }

        Optional<Account> found = accountRepository.findByReferralCodeWithLock(command.referralCode());
        if (found.isEmpty() || !found.get().isActive()) {
            log.info("유효하지 않은 추천 코드 - 추천 없이 가입 진행. code={}", command.referralCode());
            return ReferrerLookup.ignored("유효하지 않은 추천 코드입니다");
        }

        Account referrer = found.get();
        int limit = policyProperties.getReferralDailyLimit();
        long recent = referralLinkRepository.countByReferrerIdAndCreatedAtAfter(
                referrer.getAccountId(), now.minus(policyProperties.getReferralWindow()));

        if (recent >= limit) {
            if (policyProperties.getReferralLimitPolicy() == ReferralLimitPolicy.REJECT_SIGNUP) {
                throw new ReferralLimitExceededException(referrer.getAccountId(), recent, limit);
            }
            log.warn("추천 한도 초과 - 추천 없이 가입 진행. referrerId={}, recent={}, limit={}",
                    referrer.getAccountId(), recent, limit);
            return ReferrerLookup.ignored("추천인의 추천 한도를 초과했습니다");
        }
        return new ReferrerLookup(referrer, null);
    }

    private ActivePromotion activeEvent(PromotionEventType type, LocalDateTime now) {
        return promotionEventRegistry.findBestActive(type, now).orElse(null);
    }

    private record ReferrerLookup(Account referrer, String ignoredReason) {

        static ReferrerLookup none() {
            return new ReferrerLookup(null, null);
        }

        static ReferrerLookup ignored(String reason) {
            return new ReferrerLookup(null, reason);
        }
    }
}
