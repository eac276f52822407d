package personal.studio.schedule.scheduling.domain.model;

import java.util.List;

/**
 * Lesson 생성 결과
 *
 * @param created 새로 저장된 수업
 * @param skipped 충돌로 건너뛴 날짜
 */
public record GenerationResult(
        List<LessonOccurrence> created,
        List<SkippedOccurrence> skipped
) {
    public GenerationResult {
        created = List.copyOf(created);
        skipped = List.copyOf(skipped);
    }

    public static GenerationResult empty() {
        return new GenerationResult(List.of(), List.of());
    }

    public int createdCount() {
        return created.size();
    }

    public int skippedCount() {
        return skipped.size();
    }
}
