package personal.studio.schedule.scheduling.domain.model;

import java.util.List;
import java.util.Set;

/**
 * 패턴 변경 결과
 *
 * @param rescheduledLessons 새 템플릿으로 옮겨진 수업 수
 * @param deletedLessons     종료일 단축으로 삭제된 수업 수
 * @param conflicts          force 변경에서 보고된 충돌 (SKIP_CONFLICTS 면 옮기지 못한 수업)
 * @param generation         기간 연장/재활성화로 생성된 수업
 */
public record PatternUpdateResult(
        RecurringPattern pattern,
        Set<Long> studentIds,
        int rescheduledLessons,
        int deletedLessons,
        List<ConflictDescriptor> conflicts,
        GenerationResult generation
) {
    public PatternUpdateResult {
        conflicts = List.copyOf(conflicts);
    }
}
