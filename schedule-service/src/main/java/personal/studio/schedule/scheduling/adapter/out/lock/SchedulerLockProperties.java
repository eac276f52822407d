package personal.studio.schedule.scheduling.adapter.out.lock;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 스케줄러 잠금 설정
 *
 * scheduler:
 *   lock:
 *     strategy: redis   # none | redis
 *     ttl-seconds: 600
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "scheduler.lock")
public class SchedulerLockProperties {

    private String strategy = "none";

    /**
     * 학원 1곳의 생성 작업이 끝날 때까지 충분한 시간
     */
    private int ttlSeconds = 600;
}
