package personal.studio.schedule.scheduling.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import personal.studio.schedule.scheduling.application.port.in.CreatePatternCommand;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * 반복 패턴 등록 요청 DTO
 */
public record CreatePatternRequest(
        @NotNull(message = "학원 ID는 필수입니다.")
        Long studioId,

        @NotNull(message = "강사 ID는 필수입니다.")
        Long teacherId,

        Long roomId,

        @NotNull(message = "요일은 필수입니다.")
        @Min(value = 1, message = "요일은 1(월)~7(일) 사이여야 합니다.")
        @Max(value = 7, message = "요일은 1(월)~7(일) 사이여야 합니다.")
        Integer dayOfWeek,

        @NotNull(message = "시작 시각은 필수입니다.")
        LocalTime startTime,

        @Min(value = 30, message = "수업 시간은 30분 이상이어야 합니다.")
        @Max(value = 180, message = "수업 시간은 180분 이하여야 합니다.")
        Integer durationMinutes,

        @NotNull(message = "시작일은 필수입니다.")
        LocalDate validFrom,

        LocalDate validUntil,

        String notes,

        List<Long> studentIds
) {
    private static final int DEFAULT_DURATION_MINUTES = 60;

    public CreatePatternCommand toCommand() {
        return new CreatePatternCommand(
                studioId,
                teacherId,
                roomId,
                dayOfWeek,
                startTime,
                durationMinutes != null ? durationMinutes : DEFAULT_DURATION_MINUTES,
                validFrom,
                validUntil,
                notes,
                studentIds != null ? Set.copyOf(studentIds) : Set.of());
    }
}
