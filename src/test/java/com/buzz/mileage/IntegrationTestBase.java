package com.buzz.mileage;

import com.buzz.mileage.application.signup.dto.SignupCommand;
import com.buzz.mileage.application.signup.dto.SignupResponse;
import com.buzz.mileage.application.signup.usecase.SignupUseCase;
import com.buzz.mileage.domain.risk.service.SignupAttemptCounter;
import org.junit.jupiter.api.AfterEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

/**
 * 통합 테스트 공통 설정 (H2 MySQL 모드)
 *
 * 동시성 테스트가 여러 트랜잭션을 실제로 커밋해야 하므로 테스트 단위 롤백 대신 테이블을 비운다.
 * Redis 카운터는 MockBean 으로 대체한다.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class IntegrationTestBase {

    private static final List<String> TABLES = List.of(
            "qr_usage_logs", "qr_tokens", "settlements", "coupons", "ledger_entries",
            "referrals", "promotion_events", "signup_attempts", "device_fingerprints",
            "ip_blacklist", "event_outbox", "accounts");

    protected static final String USER_AGENT =
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 14_0) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0";

    @MockBean
    protected SignupAttemptCounter signupAttemptCounter;

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected SignupUseCase signupUseCase;

    @AfterEach
    void cleanUpDatabase() {
        TABLES.forEach(table -> jdbcTemplate.execute("DELETE FROM " + table));
        clock.reset();
    }

    protected SignupResponse signup(String email, String referralCode) {
        return signupUseCase.execute(new SignupCommand(
                email, "테스트", null, referralCode, "203.0.113.10", USER_AGENT, null));
    }
}
