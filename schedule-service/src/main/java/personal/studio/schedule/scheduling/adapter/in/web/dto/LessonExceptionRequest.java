package personal.studio.schedule.scheduling.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import personal.studio.schedule.scheduling.application.port.in.LessonExceptionCommand;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * 수업 개별 변경 요청 DTO
 *
 * @param online true 면 강의실 해제
 * @param cancel true 면 수업 취소
 */
public record LessonExceptionRequest(
        LocalDate lessonDate,
        LocalTime startTime,

        @Min(value = 30, message = "수업 시간은 30분 이상이어야 합니다.")
        @Max(value = 180, message = "수업 시간은 180분 이하여야 합니다.")
        Integer durationMinutes,

        Long roomId,
        Boolean online,
        String notes,
        Boolean cancel,
        String cancellationReason
) {
    public LessonExceptionCommand toCommand(Long lessonId) {
        return new LessonExceptionCommand(lessonId, lessonDate, startTime, durationMinutes, roomId,
                Boolean.TRUE.equals(online), notes, Boolean.TRUE.equals(cancel), cancellationReason);
    }
}
