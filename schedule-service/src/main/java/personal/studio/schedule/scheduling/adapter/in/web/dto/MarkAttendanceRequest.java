package personal.studio.schedule.scheduling.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.studio.schedule.scheduling.application.port.in.MarkAttendanceCommand;
import personal.studio.schedule.scheduling.domain.model.AttendanceStatus;

/**
 * 출석 체크 요청 DTO
 */
public record MarkAttendanceRequest(
        @NotNull(message = "출석 상태는 필수입니다.")
        AttendanceStatus status
) {
    public MarkAttendanceCommand toCommand(Long lessonId, Long studentId) {
        return new MarkAttendanceCommand(lessonId, studentId, status);
    }
}
