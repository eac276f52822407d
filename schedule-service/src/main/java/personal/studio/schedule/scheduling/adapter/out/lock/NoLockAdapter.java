package personal.studio.schedule.scheduling.adapter.out.lock;

import lombok.extern.slf4j.Slf4j;
import personal.studio.schedule.scheduling.application.port.out.SchedulerLockPort;

/**
 * 잠금 없이 항상 실행을 허용하는 어댑터
 * 단일 인스턴스에서만 사용한다.
 */
@Slf4j
public class NoLockAdapter implements SchedulerLockPort {

    @Override
    public boolean tryAcquire(String jobName, Long studioId) {
        log.debug("[NoLock] Always allow: job={}, studioId={}", jobName, studioId);
        return true;
    }

    @Override
    public void release(String jobName, Long studioId) {
        log.debug("[NoLock] Nothing to release: job={}, studioId={}", jobName, studioId);
    }

    @Override
    public String getStrategyName() {
        return "none";
    }
}
