package personal.studio.common.security;

/**
 * 역할별로 허용되는 작업 단위
 */
public enum Capability {
    /**
     * 모든 강사의 반복 패턴 관리
     */
    MANAGE_ANY_SCHEDULE,

    /**
     * 본인이 담당하는 반복 패턴 및 수업 관리
     */
    MANAGE_OWN_SCHEDULE,

    /**
     * 수업 출석 처리
     */
    MARK_ATTENDANCE,

    /**
     * 일정 조회
     */
    VIEW_SCHEDULE
}
