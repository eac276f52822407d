package personal.studio.schedule.scheduling.adapter.in.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import personal.studio.schedule.scheduling.application.port.in.UpdatePatternCommand;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * 반복 패턴 변경 요청 DTO (부분 변경, null 은 변경 없음)
 *
 * @param online    true 면 강의실 해제 (온라인 수업)
 * @param openEnded true 면 종료일 제거
 * @param version   클라이언트가 마지막으로 본 버전
 */
public record UpdatePatternRequest(
        Long roomId,
        Boolean online,
        LocalTime startTime,

        @Min(value = 30, message = "수업 시간은 30분 이상이어야 합니다.")
        @Max(value = 180, message = "수업 시간은 180분 이하여야 합니다.")
        Integer durationMinutes,

        LocalDate validUntil,
        Boolean openEnded,
        Boolean active,
        String notes,
        List<Long> studentIds,
        Long version
) {
    public UpdatePatternCommand toCommand(Long patternId, boolean force) {
        return new UpdatePatternCommand(
                patternId,
                roomId,
                Boolean.TRUE.equals(online),
                startTime,
                durationMinutes,
                validUntil,
                Boolean.TRUE.equals(openEnded),
                active,
                notes,
                studentIds != null ? Set.copyOf(studentIds) : null,
                version,
                force);
    }
}
