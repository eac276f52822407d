package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;
import personal.studio.schedule.scheduling.domain.model.AttendanceStatus;

/**
 * 출석 체크 커맨드
 */
public record MarkAttendanceCommand(
        Long lessonId,
        Long studentId,
        AttendanceStatus status
) {
    public MarkAttendanceCommand {
        if (lessonId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Lesson ID cannot be null");
        }
        if (studentId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Student ID cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Attendance status cannot be null");
        }
    }
}
