package personal.studio.schedule.scheduling.domain.model;

import java.util.Set;

/**
 * 패턴 등록 결과 (등록된 패턴 + 함께 생성된 수업)
 */
public record PatternCreationResult(
        RecurringPattern pattern,
        Set<Long> studentIds,
        GenerationResult generation
) {
}
