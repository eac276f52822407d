package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;

/**
 * Check Conflict Command
 * 수업을 만들거나 옮기기 전에 해당 시간대의 충돌만 미리 확인
 *
 * @param excludeLessonId 옮기려는 수업 자신 (없으면 null)
 */
public record CheckConflictCommand(
        Long studioId,
        Long teacherId,
        Long roomId,
        LocalDate lessonDate,
        LocalTime startTime,
        Integer durationMinutes,
        Set<Long> studentIds,
        Long excludeLessonId
) {
    public CheckConflictCommand {
        if (studioId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Studio ID cannot be null");
        }
        if (teacherId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Teacher ID cannot be null");
        }
        if (lessonDate == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Lesson date cannot be null");
        }
        if (startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time cannot be null");
        }
        if (durationMinutes == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Duration cannot be null");
        }
        studentIds = studentIds == null ? Set.of() : Set.copyOf(studentIds);
    }
}
