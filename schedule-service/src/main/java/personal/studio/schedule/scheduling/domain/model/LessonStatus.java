package personal.studio.schedule.scheduling.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lesson Status Enum
 * 수업 상태와 허용되는 전이
 */
public enum LessonStatus {
    /**
     * 예정된 수업
     */
    SCHEDULED,

    /**
     * 진행 완료
     */
    COMPLETED,

    /**
     * 취소 (강의실/강사/학생을 점유하지 않음)
     */
    CANCELLED,

    /**
     * 학생 불참
     */
    MISSED;

    /**
     * 상태 전이 가능 여부
     * SCHEDULED -> COMPLETED, CANCELLED, MISSED
     * COMPLETED -> MISSED
     * CANCELLED -> SCHEDULED (복구)
     */
    public boolean canTransitionTo(LessonStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<LessonStatus> allowedTargets() {
        return switch (this) {
            case SCHEDULED -> EnumSet.of(COMPLETED, CANCELLED, MISSED);
            case COMPLETED -> EnumSet.of(MISSED);
            case CANCELLED -> EnumSet.of(SCHEDULED);
            case MISSED -> EnumSet.noneOf(LessonStatus.class);
        };
    }
}
