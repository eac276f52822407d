package personal.studio.schedule.scheduling.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;
import personal.studio.schedule.scheduling.application.port.out.SchedulerLockPort;

import java.time.Duration;

/**
 * scheduler.lock.strategy 값에 따라 SchedulerLockPort 구현체 선택
 */
@Slf4j
@Configuration
public class SchedulerLockAdapterFactory {

    @Bean
    @ConditionalOnProperty(name = "scheduler.lock.strategy", havingValue = "none", matchIfMissing = true)
    public SchedulerLockPort noLockAdapter() {
        log.info("Scheduler lock strategy: none");
        return new NoLockAdapter();
    }

    @Bean
    @ConditionalOnProperty(name = "scheduler.lock.strategy", havingValue = "redis")
    public SchedulerLockPort redisLockAdapter(StringRedisTemplate redisTemplate,
                                              SchedulerLockProperties properties) {
        log.info("Scheduler lock strategy: redis, ttl={}s", properties.getTtlSeconds());
        return new RedisLockAdapter(redisTemplate, Duration.ofSeconds(properties.getTtlSeconds()));
    }
}
