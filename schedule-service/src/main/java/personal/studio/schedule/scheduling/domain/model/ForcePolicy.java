package personal.studio.schedule.scheduling.domain.model;

/**
 * force=true 로 패턴을 변경할 때 충돌 수업을 처리하는 방식
 */
public enum ForcePolicy {
    /**
     * 충돌하는 수업은 기존 시간대에 그대로 두고 나머지만 변경
     */
    SKIP_CONFLICTS,

    /**
     * 충돌 여부와 관계없이 모두 변경 (충돌은 결과로만 보고)
     */
    OVERRIDE
}
