package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;
import personal.studio.schedule.scheduling.domain.model.LessonStatus;

/**
 * 수업 상태 변경 커맨드
 */
public record ChangeLessonStatusCommand(
        Long lessonId,
        LessonStatus status,
        String reason
) {
    public ChangeLessonStatusCommand {
        if (lessonId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Lesson ID cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Status cannot be null");
        }
    }
}
