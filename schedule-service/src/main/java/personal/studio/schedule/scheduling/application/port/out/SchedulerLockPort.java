package personal.studio.schedule.scheduling.application.port.out;

/**
 * Scheduler Lock Port (Output Port)
 * 여러 인스턴스가 같은 학원의 야간 수업 생성을 동시에 실행하지 않도록 잠금
 *
 * 구현체:
 * - NoLockAdapter: 단일 인스턴스 (로컬 개발)
 * - RedisLockAdapter: Redis SET NX 기반 학원별 잠금 (운영)
 */
public interface SchedulerLockPort {

    /**
     * @param jobName  작업 이름 (예: "lesson-generation")
     * @param studioId 학원 ID
     * @return true 면 실행, false 면 다른 인스턴스가 처리 중이므로 건너뜀
     */
    boolean tryAcquire(String jobName, Long studioId);

    void release(String jobName, Long studioId);

    String getStrategyName();
}
