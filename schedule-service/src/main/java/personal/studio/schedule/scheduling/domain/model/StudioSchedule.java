package personal.studio.schedule.scheduling.domain.model;

import java.time.LocalDate;
import java.util.List;

/**
 * 학원 전체 시간표 (캐시 단위)
 */
public record StudioSchedule(
        Long studioId,
        LocalDate from,
        LocalDate to,
        List<LessonOccurrence> lessons
) {
    public StudioSchedule {
        lessons = lessons == null ? List.of() : List.copyOf(lessons);
    }
}
