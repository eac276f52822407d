package personal.studio.schedule.scheduling.domain.model;

/**
 * 학생별 출석 상태
 */
public enum AttendanceStatus {
    SCHEDULED,
    ATTENDED,
    MISSED,
    CANCELLED
}
