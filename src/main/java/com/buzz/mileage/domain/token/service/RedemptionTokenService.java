package com.buzz.mileage.domain.token.service;

import com.buzz.mileage.domain.account.entity.Account;
import com.buzz.mileage.domain.account.repository.AccountRepository;
import com.buzz.mileage.domain.coupon.entity.Coupon;
import com.buzz.mileage.domain.coupon.repository.CouponRepository;
import com.buzz.mileage.domain.token.entity.RedemptionToken;
import com.buzz.mileage.domain.token.entity.TokenAuditAction;
import com.buzz.mileage.domain.token.entity.TokenAuditLog;
import com.buzz.mileage.domain.token.entity.TokenKind;
import com.buzz.mileage.domain.token.exception.InvalidTokenException;
import com.buzz.mileage.domain.token.exception.TokenAlreadyConsumedException;
import com.buzz.mileage.domain.token.exception.TokenExpiredException;
import com.buzz.mileage.domain.token.exception.TokenNotFoundException;
import com.buzz.mileage.domain.token.repository.RedemptionTokenRepository;
import com.buzz.mileage.domain.token.repository.TokenAuditLogRepository;
import com.buzz.mileage.domain.token.vo.IssuedToken;
import com.buzz.mileage.domain.token.vo.SignedToken;
import com.buzz.mileage.domain.token.vo.TokenClaims;
import com.buzz.mileage.domain.token.vo.TokenVerification;
import com.buzz.mileage.domain.token.vo.VerificationFailure;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * QR 토큰 발급 / 검증 / 소비
 *
 * - 검증(verify)은 토큰 상태를 바꾸지 않는다. 가맹점이 결제 확정 전에 내용을 보여주기 위한 단계.
 * - 소비(consume)는 유일한 변경 연산이며 조건부 UPDATE 한 문장으로 단일 사용을 보장한다.
 * - 만료 판정은 항상 저장된 expiresAt 과 주입된 Clock 으로 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedemptionTokenService {

    private static final int PURGE_BATCH_SIZE = 500;

    private final RedemptionTokenRepository tokenRepository;
    private final TokenAuditLogRepository auditLogRepository;
    private final AccountRepository accountRepository;
    private final CouponRepository couponRepository;
    private final QrTokenSigner signer;
    private final Clock clock;

    /**
     * 토큰 발급
     * @param referenceId COUPON 토큰의 쿠폰 ID (MILEAGE 는 null)
     */
    @Transactional
    public IssuedToken issue(String accountId, TokenKind kind, String referenceId, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("토큰 유효 시간은 0보다 커야 합니다");
        }

        LocalDateTime issuedAt = LocalDateTime.now(clock);
        TokenClaims claims = new TokenClaims(
                UUID.randomUUID().toString(),
                accountId,
                kind,
                referenceId,
                issuedAt,
                issuedAt.plus(ttl),
                UUID.randomUUID().toString());

        SignedToken signed = signer.sign(claims);

        RedemptionToken token = tokenRepository.save(RedemptionToken.builder()
                .tokenId(claims.tokenId())
                .accountId(accountId)
                .kind(kind)
                .referenceId(referenceId)
                .tokenHash(signed.tokenHash())
                .issuedAt(claims.issuedAt())
                .expiresAt(claims.expiresAt())
                .consumed(false)
                .build());

        audit(token, TokenAuditAction.GENERATED, null, null, null, null);
        log.info("QR 토큰 발급 - tokenId={}, accountId={}, kind={}, expiresAt={}",
                token.getTokenId(), accountId, kind, token.getExpiresAt());

        return new IssuedToken(token.getTokenId(), accountId, kind, referenceId,
                signed.payload(), token.getIssuedAt(), token.getExpiresAt());
    }

    /**
     * 토큰 검증 (토큰 상태 변경 없음)
     *
     * 검사 순서: 형식 → 서명 → 저장 여부 → 해시 일치 → 만료 → 사용 여부 → 계정 활성 → 쿠폰 사용 가능
     * 만료를 사용 여부보다 먼저 본다. 만료 시각이 지난 토큰은 사용 여부와 무관하게 EXPIRED 이다.
     */
    @Transactional
    public TokenVerification verify(String payload) {
        TokenClaims claims;
        try {
            claims = signer.parse(payload);
        } catch (InvalidTokenException e) {
            return TokenVerification.fail(e.getFailure());
        }

        Optional<RedemptionToken> found = tokenRepository.findById(claims.tokenId());
        if (found.isEmpty()) {
            return TokenVerification.fail(VerificationFailure.NOT_FOUND);
        }

        RedemptionToken token = found.get();
        if (!token.matchesHash(signer.hashOf(payload)) || !token.getAccountId().equals(claims.accountId())) {
            return TokenVerification.fail(VerificationFailure.INVALID_SIGNATURE);
        }

        LocalDateTime now = LocalDateTime.now(clock);
        if (token.isExpiredAt(now)) {
            return TokenVerification.fail(VerificationFailure.EXPIRED, token);
        }
        if (token.isConsumed()) {
            return TokenVerification.fail(VerificationFailure.ALREADY_USED, token);
        }

        Account account = accountRepository.findById(token.getAccountId()).orElse(null);
        if (account == null || !account.isActive()) {
            return TokenVerification.fail(VerificationFailure.INACTIVE_ACCOUNT, token);
        }

        Coupon coupon = null;
        if (token.getKind() == TokenKind.COUPON) {
            coupon = couponRepository.findById(token.getReferenceId()).orElse(null);
            if (coupon == null || !coupon.isOwnedBy(account.getAccountId()) || !coupon.isUsableAt(now)) {
                return TokenVerification.fail(VerificationFailure.COUPON_UNAVAILABLE, token);
            }
        }

        audit(token, TokenAuditAction.VERIFIED, null, null, null, null);
        return TokenVerification.success(token, account, coupon);
    }

    /**
     * 페이로드로 저장된 토큰을 찾는다 (상태 검사 없이 무결성만 확인)
     *
     * @throws InvalidTokenException 형식/서명/해시 불일치
     * @throws TokenNotFoundException 발급 기록 없음
     */
    @Transactional(readOnly = true)
    public RedemptionToken resolve(String payload) {
        TokenClaims claims = signer.parse(payload);
        RedemptionToken token = tokenRepository.findById(claims.tokenId())
                .orElseThrow(() -> new TokenNotFoundException(claims.tokenId()));

        if (!token.matchesHash(signer.hashOf(payload))) {
            throw new InvalidTokenException(VerificationFailure.INVALID_SIGNATURE, "QR 서명이 발급 기록과 다릅니다");
        }
        return token;
    }

    /**
     * 토큰 소비 (compare-and-set)
     * 원장 차감/쿠폰 사용/정산 생성과 같은 트랜잭션 안에서만 호출할 수 있다.
     *
     * @throws TokenAlreadyConsumedException 다른 요청이 먼저 소비함
     * @throws TokenExpiredException 만료됨
     * @throws TokenNotFoundException 토큰 없음
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public RedemptionToken consume(String tokenId, String merchantId) {
        LocalDateTime now = LocalDateTime.now(clock);

        int updated = tokenRepository.consume(tokenId, merchantId, now);
        if (updated == 0) {
            RedemptionToken current = tokenRepository.findById(tokenId)
                    .orElseThrow(() -> new TokenNotFoundException(tokenId));
            if (current.isExpiredAt(now)) {
                throw new TokenExpiredException(tokenId, current.getExpiresAt());
            }
            log.warn("QR 토큰 중복 소비 시도 - tokenId={}, merchantId={}", tokenId, merchantId);
            throw new TokenAlreadyConsumedException(tokenId);
        }

        return tokenRepository.findById(tokenId)
                .orElseThrow(() -> new TokenNotFoundException(tokenId));
    }

    /**
     * 사용 완료 이력 기록 (소비와 같은 트랜잭션)
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void recordUsage(RedemptionToken token, String merchantId, Long amount, Long discountAmount, Long subsidyAmount) {
        audit(token, TokenAuditAction.USED, merchantId, amount, discountAmount, subsidyAmount);
    }

    /**
     * 보관 기간이 지난 미사용 만료 토큰 삭제. 삭제 전 EXPIRED 이력을 남긴다.
     * @return 삭제한 토큰 수
     */
    @Transactional
    public int purgeExpired(LocalDateTime cutoff) {
        List<RedemptionToken> expired = tokenRepository.findExpiredUnconsumedBefore(
                cutoff, PageRequest.of(0, PURGE_BATCH_SIZE));
        if (expired.isEmpty()) {
            return 0;
        }

        for (RedemptionToken token : expired) {
            audit(token, TokenAuditAction.EXPIRED, null, null, null, null);
        }
        tokenRepository.deleteAllInBatch(expired);

        log.info("만료 QR 토큰 정리 - count={}, cutoff={}", expired.size(), cutoff);
        return expired.size();
    }

    private void audit(RedemptionToken token, TokenAuditAction action, String merchantId,
                       Long amount, Long discountAmount, Long subsidyAmount) {
        auditLogRepository.save(TokenAuditLog.builder()
                .tokenId(token.getTokenId())
                .accountId(token.getAccountId())
                .action(action)
                .kind(token.getKind())
                .merchantId(merchantId)
                .amount(amount)
                .discountAmount(discountAmount)
                .subsidyAmount(subsidyAmount)
                .createdAt(LocalDateTime.now(clock))
                .build());
    }
}
