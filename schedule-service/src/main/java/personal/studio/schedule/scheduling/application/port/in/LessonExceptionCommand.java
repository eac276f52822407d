package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Lesson Exception Command
 * 수업 1건만 패턴과 다르게 변경 (날짜/시간/길이/강의실/메모) 하거나 취소
 *
 * @param clearRoom 온라인 수업으로 변경
 * @param cancel    true 면 나머지 일정 변경 없이 취소
 */
public record LessonExceptionCommand(
        Long lessonId,
        LocalDate lessonDate,
        LocalTime startTime,
        Integer durationMinutes,
        Long roomId,
        boolean clearRoom,
        String notes,
        boolean cancel,
        String cancellationReason
) {
    public LessonExceptionCommand {
        if (lessonId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Lesson ID cannot be null");
        }
        if (clearRoom && roomId != null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Room ID cannot be set when clearing the room");
        }
        if (cancel && changesSlot(lessonDate, startTime, durationMinutes, roomId, clearRoom)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "A cancelled lesson cannot be rescheduled");
        }
        if (!cancel && notes == null && !changesSlot(lessonDate, startTime, durationMinutes, roomId, clearRoom)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "No changes requested");
        }
    }

    private static boolean changesSlot(LocalDate lessonDate, LocalTime startTime, Integer durationMinutes,
                                       Long roomId, boolean clearRoom) {
        return lessonDate != null || startTime != null || durationMinutes != null || roomId != null || clearRoom;
    }

    public boolean changesSlot() {
        return changesSlot(lessonDate, startTime, durationMinutes, roomId, clearRoom);
    }
}
