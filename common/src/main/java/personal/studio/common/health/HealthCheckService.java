package personal.studio.common.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import personal.studio.common.dto.HealthCheckResponse;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;

/**
 * 일정 서비스가 의존하는 저장소(PostgreSQL, Redis) 상태 점검
 * 개별 점검 실패는 DOWN 으로 보고하고 예외를 밖으로 던지지 않는다
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HealthCheckService {

    private static final int DB_VALIDATION_TIMEOUT_SECONDS = 1;

    private final DataSource dataSource;
    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    public HealthCheckResponse check() {
        return new HealthCheckResponse(checkDatabase(), checkRedis(), Instant.now(clock));
    }

    /**
     * 패턴/레슨 저장소 연결 확인
     */
    ComponentStatus checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(DB_VALIDATION_TIMEOUT_SECONDS) ? ComponentStatus.UP : ComponentStatus.DOWN;
        } catch (Exception e) {
            log.error("Lesson store health check failed", e);
            return ComponentStatus.DOWN;
        }
    }

    /**
     * 일정 캐시 및 스케줄러 락 저장소 연결 확인
     */
    ComponentStatus checkRedis() {
        try {
            String pong = redisTemplate.execute((RedisConnection connection) -> connection.ping());
            return "PONG".equals(pong) ? ComponentStatus.UP : ComponentStatus.DOWN;
        } catch (Exception e) {
            log.error("Schedule cache health check failed", e);
            return ComponentStatus.DOWN;
        }
    }
}
