package personal.studio.schedule.scheduling.domain.model;

import java.util.Set;

/**
 * 조회용 패턴 정보 (학생 목록 + 생성된 수업 수)
 */
public record PatternDetails(
        RecurringPattern pattern,
        Set<Long> studentIds,
        long generatedLessons
) {
}
