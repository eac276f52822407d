package personal.studio.schedule.scheduling.adapter.in.web.dto;

import personal.studio.schedule.scheduling.domain.model.StudioSchedule;

import java.time.LocalDate;
import java.util.List;

/**
 * 학원 시간표 응답 DTO
 */
public record StudioScheduleResponse(
        Long studioId,
        LocalDate from,
        LocalDate to,
        List<LessonResponse> lessons
) {
    public static StudioScheduleResponse from(StudioSchedule schedule) {
        return new StudioScheduleResponse(schedule.studioId(), schedule.from(), schedule.to(),
                LessonResponse.fromAll(schedule.lessons()));
    }
}
