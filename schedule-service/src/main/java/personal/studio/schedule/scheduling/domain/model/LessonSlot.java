package personal.studio.schedule.scheduling.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 패턴에서 계산된 수업 후보 시간대
 */
public record LessonSlot(
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime
) {
}
