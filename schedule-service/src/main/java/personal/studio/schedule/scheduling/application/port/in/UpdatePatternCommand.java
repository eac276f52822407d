package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;
import personal.studio.schedule.scheduling.domain.model.RecurringPattern;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;

/**
 * Update Pattern Command
 * null 인 항목은 변경하지 않는다. 요일과 시작일은 변경할 수 없다.
 *
 * @param clearRoom       true 면 온라인 수업으로 변경 (roomId 무시)
 * @param clearValidUntil true 면 종료일 제거 (validUntil 무시)
 * @param studentIds      null 이면 학생 변경 없음, 빈 집합이면 모든 학생 제거
 * @param expectedVersion 클라이언트가 알고 있는 버전 (null 이면 검사하지 않음)
 * @param force           충돌이 있어도 설정된 정책대로 변경 진행
 */
public record UpdatePatternCommand(
        Long patternId,
        Long roomId,
        boolean clearRoom,
        LocalTime startTime,
        Integer durationMinutes,
        LocalDate validUntil,
        boolean clearValidUntil,
        Boolean active,
        String notes,
        Set<Long> studentIds,
        Long expectedVersion,
        boolean force
) {
    public UpdatePatternCommand {
        if (patternId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Pattern ID cannot be null");
        }
        if (clearRoom && roomId != null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Room ID cannot be set when clearing the room");
        }
        if (clearValidUntil && validUntil != null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    "Valid-until cannot be set when clearing the end date");
        }
        studentIds = studentIds == null ? null : Set.copyOf(studentIds);
    }

    public static UpdatePatternCommand deactivate(Long patternId) {
        return new UpdatePatternCommand(patternId, null, false, null, null, null, false,
                false, null, null, null, false);
    }

    /**
     * 변경 사항을 적용한 새 패턴 (검증은 RecurringPattern 생성자에서 수행)
     */
    public RecurringPattern applyTo(RecurringPattern current) {
        Long newRoomId = clearRoom ? null : (roomId != null ? roomId : current.roomId());
        LocalTime newStartTime = startTime != null ? startTime : current.startTime();
        int newDuration = durationMinutes != null ? durationMinutes : current.durationMinutes();
        LocalDate newValidUntil = clearValidUntil ? null : (validUntil != null ? validUntil : current.validUntil());

        RecurringPattern updated = current.withTemplate(newRoomId, newStartTime, newDuration)
                .withValidUntil(newValidUntil);
        if (active != null) {
            updated = updated.withActive(active);
        }
        if (notes != null) {
            updated = updated.withNotes(notes);
        }
        return updated;
    }

    public boolean changesStudents(Set<Long> currentStudentIds) {
        return studentIds != null && !studentIds.equals(currentStudentIds);
    }
}
