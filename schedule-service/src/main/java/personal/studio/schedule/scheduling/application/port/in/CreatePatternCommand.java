package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;

/**
 * Create Pattern Command
 * 반복 패턴 등록 커맨드 (범위 검증은 RecurringPattern 에서 수행)
 */
public record CreatePatternCommand(
        Long studioId,
        Long teacherId,
        Long roomId,
        Integer dayOfWeek,
        LocalTime startTime,
        Integer durationMinutes,
        LocalDate validFrom,
        LocalDate validUntil,
        String notes,
        Set<Long> studentIds
) {
    public CreatePatternCommand {
        if (studioId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Studio ID cannot be null");
        }
        if (teacherId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Teacher ID cannot be null");
        }
        if (dayOfWeek == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Day of week cannot be null");
        }
        if (startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time cannot be null");
        }
        if (durationMinutes == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Duration cannot be null");
        }
        if (validFrom == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Valid-from date cannot be null");
        }
        studentIds = studentIds == null ? Set.of() : Set.copyOf(studentIds);
    }
}
