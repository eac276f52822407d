package personal.studio.schedule.scheduling.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import personal.studio.schedule.scheduling.application.port.in.CreateLessonCommand;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * 단건 수업 등록 요청 DTO
 */
public record CreateLessonRequest(
        @NotNull(message = "학원 ID는 필수입니다.")
        Long studioId,

        @NotNull(message = "강사 ID는 필수입니다.")
        Long teacherId,

        Long roomId,

        @NotNull(message = "수업 날짜는 필수입니다.")
        LocalDate lessonDate,

        @NotNull(message = "시작 시각은 필수입니다.")
        LocalTime startTime,

        @NotNull(message = "수업 시간은 필수입니다.")
        @Min(value = 30, message = "수업 시간은 30분 이상이어야 합니다.")
        @Max(value = 180, message = "수업 시간은 180분 이하여야 합니다.")
        Integer durationMinutes,

        String notes,

        List<Long> studentIds
) {
    public CreateLessonCommand toCommand() {
        return new CreateLessonCommand(studioId, teacherId, roomId, lessonDate, startTime, durationMinutes, notes,
                studentIds != null ? Set.copyOf(studentIds) : Set.of());
    }
}
