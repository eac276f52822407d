package personal.studio.schedule.scheduling.adapter.out.lock;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import personal.studio.schedule.scheduling.application.port.out.SchedulerLockPort;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Redis Lock Adapter
 * 학원별 SET NX + TTL 잠금. 해제는 소유자일 때만 Lua 스크립트로 수행한다.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisLockAdapter implements SchedulerLockPort {

    private static final String RELEASE_SCRIPT = """
            if redis.call('get', KEYS[1]) == ARGV[1] then
                return redis.call('del', KEYS[1])
            end
            return 0
            """;

    private final StringRedisTemplate redisTemplate;
    private final Duration lockTtl;

    private final String ownerId = UUID.randomUUID().toString();

    @Override
    public boolean tryAcquire(String jobName, Long studioId) {
        String lockKey = lockKey(jobName, studioId);
        try {
            boolean acquired = Boolean.TRUE.equals(
                    redisTemplate.opsForValue().setIfAbsent(lockKey, ownerId, lockTtl));
            log.debug("[RedisLock] Acquire: key={}, acquired={}", lockKey, acquired);
            return acquired;
        } catch (DataAccessException e) {
            // Redis 장애 시 실행하지 않음
            log.error("[RedisLock] Failed to acquire lock: key={}", lockKey, e);
            return false;
        }
    }

    @Override
    public void release(String jobName, Long studioId) {
        String lockKey = lockKey(jobName, studioId);
        try {
            Long released = redisTemplate.execute(
                    new DefaultRedisScript<>(RELEASE_SCRIPT, Long.class), List.of(lockKey), ownerId);
            log.debug("[RedisLock] Release: key={}, released={}", lockKey, released != null && released > 0);
        } catch (DataAccessException e) {
            // 해제 실패 시 TTL 만료로 풀린다
            log.error("[RedisLock] Failed to release lock: key={}", lockKey, e);
        }
    }

    @Override
    public String getStrategyName() {
        return "redis";
    }

    private String lockKey(String jobName, Long studioId) {
        return String.format("schedule:lock:%s:{%d}", jobName, studioId);
    }
}
