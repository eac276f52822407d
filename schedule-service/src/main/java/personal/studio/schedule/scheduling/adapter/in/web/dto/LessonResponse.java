package personal.studio.schedule.scheduling.adapter.in.web.dto;

import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.model.LessonStatus;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 수업 응답 DTO
 */
public record LessonResponse(
        Long lessonId,
        Long studioId,
        Long teacherId,
        Long roomId,
        Long patternId,
        LocalDate lessonDate,
        LocalTime startTime,
        LocalTime endTime,
        int durationMinutes,
        LessonStatus status,
        boolean exception,
        LocalDate originalDate,
        String cancellationReason,
        String notes,
        List<AttendanceResponse> attendance,
        Long version
) {
    public static LessonResponse from(LessonOccurrence lesson) {
        return new LessonResponse(
                lesson.id(),
                lesson.studioId(),
                lesson.teacherId(),
                lesson.roomId(),
                lesson.patternId(),
                lesson.lessonDate(),
                lesson.startTime(),
                lesson.endTime(),
                lesson.durationMinutes(),
                lesson.status(),
                lesson.exception(),
                lesson.originalDate(),
                lesson.cancellationReason(),
                lesson.notes(),
                lesson.attendance().stream().map(AttendanceResponse::from).toList(),
                lesson.version()
        );
    }

    public static List<LessonResponse> fromAll(List<LessonOccurrence> lessons) {
        return lessons.stream().map(LessonResponse::from).toList();
    }
}
