package com.buzz.mileage.application.signup;

import com.buzz.mileage.IntegrationTestBase;
import com.buzz.mileage.application.mileage.dto.AdjustMileageRequest;
import com.buzz.mileage.application.mileage.usecase.AdjustMileageUseCase;
import com.buzz.mileage.application.signup.dto.SignupResponse;
import com.buzz.mileage.domain.ledger.service.MileageLedger;
import com.buzz.mileage.domain.risk.repository.SignupAttemptRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisConnectionException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.test.context.TestPropertySource;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.mock;

/**
 * 분산 락을 켠 상태에서 Redis 가 내려간 경우의 가입 흐름
 *
 * 락 저장소와 위험도 카운터가 같은 Redis 를 쓰므로 둘 다 실패하는 상황을 만든다.
 */
@TestPropertySource(properties = "buzz.lock.distributed.enabled=true")
@DisplayName("Redis 장애 시 가입 fail-open 통합 테스트")
class SignupLockFailOpenIntegrationTest extends IntegrationTestBase {

    @MockBean
    private RedissonClient redissonClient;

    @Autowired
    private AdjustMileageUseCase adjustMileageUseCase;

    @Autowired
    private MileageLedger mileageLedger;

    @Autowired
    private SignupAttemptRepository signupAttemptRepository;

    @BeforeEach
    void redisDown() throws InterruptedException {
        RLock rLock = mock(RLock.class);
        given(redissonClient.getLock(anyString())).willReturn(rLock);
        given(rLock.tryLock(anyLong(), anyLong(), any(TimeUnit.class)))
                .willThrow(new RedisConnectionException("Unable to connect to Redis server: localhost/127.0.0.1:6379"));

        given(signupAttemptCounter.countRecent(anyString(), any()))
                .willThrow(new RedisConnectionFailureException("Unable to connect to Redis"));
        willThrow(new RedisConnectionFailureException("Unable to connect to Redis"))
                .given(signupAttemptCounter).record(anyString(), anyString(), any());
    }

    @Test
    @DisplayName("락 저장소와 위험도 카운터가 모두 장애여도 가입은 락 없이 완료된다")
    void 락_저장소_장애_가입() {
        // when
        SignupResponse response = signup("redis-down@example.com", null);

        // then
        assertThat(response.accountId()).isNotNull();
        assertThat(response.riskScore()).isZero();
        assertThat(mileageLedger.balanceOf(response.accountId())).isEqualTo(response.signupBonus());
        assertThat(signupAttemptRepository.findAll())
                .singleElement()
                .satisfies(attempt -> {
                    assertThat(attempt.isFlagged()).isTrue();
                    assertThat(attempt.getRiskFactors()).contains("RedisConnectionFailureException");
                });
    }

    @Test
    @DisplayName("fail-open 을 켜지 않은 락은 저장소 장애를 그대로 전파한다")
    void 일반_락_장애_전파() {
        // given
        SignupResponse account = signup("adjust@example.com", null);

        // when & then
        assertThatThrownBy(() -> adjustMileageUseCase.execute(account.accountId(),
                new AdjustMileageRequest(-500L, "오지급 회수", "ADMIN-1")))
                .isInstanceOf(RedisConnectionException.class);
        assertThat(mileageLedger.balanceOf(account.accountId())).isEqualTo(account.signupBonus());
    }
}
