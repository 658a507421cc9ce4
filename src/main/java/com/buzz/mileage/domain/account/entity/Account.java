package com.buzz.mileage.domain.account.entity;

import com.buzz.mileage.domain.account.vo.MileageBalance;
import com.buzz.mileage.infrastructure.jpa.BaseEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 회원 계정
 *
 * balance 는 원장(ledger_entries) 합계의 캐시이며 MileageLedger 를 통해서만 변경된다.
 * 삭제하지 않고 비활성화만 한다.
 */
@Entity
@Table(name = "accounts", uniqueConstraints = {
        @UniqueConstraint(name = "uk_accounts_email", columnNames = "email"),
        @UniqueConstraint(name = "uk_accounts_phone", columnNames = "phone"),
        @UniqueConstraint(name = "uk_accounts_referral_code", columnNames = "referral_code")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class Account extends BaseEntity {

    @Id
    @Column(name = "id")
    @GeneratedValue(strategy = GenerationType.UUID)
    private String accountId;

    @Column(nullable = false)
    private String email;

    @Column(nullable = false)
    private String name;

    @Column
    private String phone;

    @Column(name = "referral_code", nullable = false, updatable = false, length = 32)
    private String referralCode;

    @Embedded
    private MileageBalance balance;

    @Column(name = "active", nullable = false)
    private boolean active;

    @PrePersist
    protected void onCreate() {
        if (balance == null) {
            balance = MileageBalance.zero();
        }
    }

    public static Account open(String email, String name, String phone, String referralCode) {
        return Account.builder()
                .email(email)
                .name(name)
                .phone(phone)
                .referralCode(referralCode)
                .balance(MileageBalance.zero())
                .active(true)
                .build();
    }

    public void deactivate() {
        this.active = false;
    }

    public long getBalanceAmount() {
        return balance == null ? 0L : balance.amount();
    }
}
