package personal.studio.schedule.scheduling.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;
import personal.studio.schedule.scheduling.application.port.in.ChangeLessonStatusCommand;
import personal.studio.schedule.scheduling.domain.model.LessonStatus;

/**
 * 수업 상태 변경 요청 DTO
 */
public record ChangeLessonStatusRequest(
        @NotNull(message = "변경할 상태는 필수입니다.")
        LessonStatus status,

        String reason
) {
    public ChangeLessonStatusCommand toCommand(Long lessonId) {
        return new ChangeLessonStatusCommand(lessonId, status, reason);
    }
}
