package personal.studio.schedule.scheduling.domain.model;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;
import personal.studio.schedule.scheduling.domain.exception.InvalidPatternException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Recurring Pattern Domain Model
 * 매주 같은 요일/시간에 반복되는 수업 템플릿
 *
 * @param roomId     강의실 ID (null 이면 온라인 수업)
 * @param dayOfWeek  ISO 요일 (1=월요일, 7=일요일)
 * @param validUntil 종료일 (null 이면 종료일 없음)
 * @param version    낙관적 락 버전 (저장 전에는 null)
 */
public record RecurringPattern(
        Long id,
        Long studioId,
        Long teacherId,
        Long roomId,
        int dayOfWeek,
        LocalTime startTime,
        int durationMinutes,
        LocalDate validFrom,
        LocalDate validUntil,
        boolean active,
        String notes,
        Long version
) {
    public static final int MIN_DURATION_MINUTES = 30;
    public static final int MAX_DURATION_MINUTES = 180;

    public RecurringPattern {
        if (studioId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Studio ID cannot be null");
        }
        if (teacherId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Teacher ID cannot be null");
        }
        if (startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time cannot be null");
        }
        if (validFrom == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Valid-from date cannot be null");
        }
        if (dayOfWeek < 1 || dayOfWeek > 7) {
            throw new InvalidPatternException(
                    String.format("Day of week must be between 1 and 7: %d", dayOfWeek));
        }
        if (durationMinutes < MIN_DURATION_MINUTES || durationMinutes > MAX_DURATION_MINUTES) {
            throw new InvalidPatternException(String.format(
                    "Duration must be between %d and %d minutes: %d",
                    MIN_DURATION_MINUTES, MAX_DURATION_MINUTES, durationMinutes));
        }
        if (validUntil != null && validUntil.isBefore(validFrom)) {
            throw new InvalidPatternException(String.format(
                    "Valid-until %s is before valid-from %s", validUntil, validFrom));
        }
        if (startTime.plusMinutes(durationMinutes).isBefore(startTime)
                || startTime.plusMinutes(durationMinutes).equals(LocalTime.MIDNIGHT)) {
            throw new InvalidPatternException(String.format(
                    "Lesson starting at %s with %d minutes runs past midnight", startTime, durationMinutes));
        }
    }

    /**
     * 신규 패턴 생성 (활성 상태)
     */
    public static RecurringPattern create(Long studioId, Long teacherId, Long roomId, int dayOfWeek,
                                          LocalTime startTime, int durationMinutes,
                                          LocalDate validFrom, LocalDate validUntil, String notes) {
        return new RecurringPattern(null, studioId, teacherId, roomId, dayOfWeek, startTime,
                durationMinutes, validFrom, validUntil, true, notes, null);
    }

    public DayOfWeek weekday() {
        return DayOfWeek.of(dayOfWeek);
    }

    public LocalTime endTime() {
        return startTime.plusMinutes(durationMinutes);
    }

    public boolean isOpenEnded() {
        return validUntil == null;
    }

    public boolean isOnline() {
        return roomId == null;
    }

    /**
     * 해당 날짜가 유효 기간 안에 있는지
     */
    public boolean coversDate(LocalDate date) {
        return !date.isBefore(validFrom) && (validUntil == null || !date.isAfter(validUntil));
    }

    /**
     * 강의실/시간/길이가 같은지 (기존 수업 재배치가 필요한지 판단)
     */
    public boolean hasSameTemplateAs(RecurringPattern other) {
        return Objects.equals(roomId, other.roomId)
                && startTime.equals(other.startTime)
                && durationMinutes == other.durationMinutes;
    }

    /**
     * 이전 패턴보다 종료일이 앞당겨졌는지
     */
    public boolean shortensValidityOf(RecurringPattern previous) {
        if (validUntil == null) {
            return false;
        }
        return previous.validUntil == null || validUntil.isBefore(previous.validUntil);
    }

    /**
     * 이전 패턴보다 종료일이 늘어났는지 (종료일 제거 포함)
     */
    public boolean extendsValidityOf(RecurringPattern previous) {
        if (previous.validUntil == null) {
            return false;
        }
        return validUntil == null || validUntil.isAfter(previous.validUntil);
    }

    public boolean isReactivationOf(RecurringPattern previous) {
        return active && !previous.active;
    }

    public RecurringPattern withTemplate(Long newRoomId, LocalTime newStartTime, int newDurationMinutes) {
        return new RecurringPattern(id, studioId, teacherId, newRoomId, dayOfWeek, newStartTime,
                newDurationMinutes, validFrom, validUntil, active, notes, version);
    }

    public RecurringPattern withValidUntil(LocalDate newValidUntil) {
        return new RecurringPattern(id, studioId, teacherId, roomId, dayOfWeek, startTime,
                durationMinutes, validFrom, newValidUntil, active, notes, version);
    }

    public RecurringPattern withActive(boolean newActive) {
        return new RecurringPattern(id, studioId, teacherId, roomId, dayOfWeek, startTime,
                durationMinutes, validFrom, validUntil, newActive, notes, version);
    }

    public RecurringPattern withNotes(String newNotes) {
        return new RecurringPattern(id, studioId, teacherId, roomId, dayOfWeek, startTime,
                durationMinutes, validFrom, validUntil, active, newNotes, version);
    }
}
