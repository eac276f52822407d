package personal.studio.schedule.scheduling.adapter.out.lock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisLockAdapter 단위 테스트")
class RedisLockAdapterTest {

    private static final Duration TTL = Duration.ofSeconds(600);

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisLockAdapter redisLockAdapter;

    @BeforeEach
    void setUp() {
        redisLockAdapter = new RedisLockAdapter(redisTemplate, TTL);
        given(redisTemplate.opsForValue()).willReturn(valueOperations);
    }

    @Test
    @DisplayName("키가 비어 있으면 락을 획득한다")
    void tryAcquire_success() {
        given(valueOperations.setIfAbsent(eq("schedule:lock:lesson-generation:{1}"), anyString(), eq(TTL)))
                .willReturn(true);

        assertThat(redisLockAdapter.tryAcquire("lesson-generation", 1L)).isTrue();
    }

    @Test
    @DisplayName("다른 인스턴스가 키를 가지고 있으면 획득 실패")
    void tryAcquire_held() {
        given(valueOperations.setIfAbsent(eq("schedule:lock:lesson-generation:{1}"), anyString(), eq(TTL)))
                .willReturn(false);

        assertThat(redisLockAdapter.tryAcquire("lesson-generation", 1L)).isFalse();
    }

    @Test
    @DisplayName("Redis 장애 시 실행하지 않도록 false 를 반환한다")
    void tryAcquire_redisDown() {
        given(valueOperations.setIfAbsent(anyString(), anyString(), eq(TTL)))
                .willThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(redisLockAdapter.tryAcquire("lesson-generation", 1L)).isFalse();
    }
}
