package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;

/**
 * Create Lesson Command
 * 패턴 없이 단건 수업 등록
 */
public record CreateLessonCommand(
        Long studioId,
        Long teacherId,
        Long roomId,
        LocalDate lessonDate,
        LocalTime startTime,
        Integer durationMinutes,
        String notes,
        Set<Long> studentIds
) {
    public CreateLessonCommand {
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
