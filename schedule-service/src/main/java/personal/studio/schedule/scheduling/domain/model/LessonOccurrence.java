package personal.studio.schedule.scheduling.domain.model;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;
import personal.studio.schedule.scheduling.domain.exception.AttendanceNotFoundException;
import personal.studio.schedule.scheduling.domain.exception.InvalidLessonStatusException;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lesson Occurrence Domain Model
 * 특정 날짜에 실제로 진행되는 수업 1건 (패턴에서 생성되었거나 단건 등록)
 *
 * @param roomId             강의실 ID (null 이면 온라인)
 * @param patternId          생성한 패턴 ID (null 이면 단건 수업)
 * @param originalDate       패턴 기준 원래 날짜 (개별 변경으로 날짜가 바뀌어도 유지, 단건 수업은 null)
 * @param exception          패턴과 다르게 개별 변경된 수업 여부
 * @param attendance         학생별 출석 정보
 */
public record LessonOccurrence(
        Long id,
        Long studioId,
        Long teacherId,
        Long roomId,
        Long patternId,
        LocalDate lessonDate,
        LocalTime startTime,
        LocalTime endTime,
        LocalDate originalDate,
        LessonStatus status,
        boolean exception,
        String cancellationReason,
        String notes,
        List<AttendanceRecord> attendance,
        Long version
) {
    public LessonOccurrence {
        if (studioId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Studio ID cannot be null");
        }
        if (teacherId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Teacher ID cannot be null");
        }
        if (lessonDate == null || startTime == null || endTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Lesson date and time cannot be null");
        }
        if (!endTime.isAfter(startTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT,
                    String.format("End time %s must be after start time %s", endTime, startTime));
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Lesson status cannot be null");
        }
        attendance = attendance == null ? List.of() : List.copyOf(attendance);
        Set<Long> seen = new HashSet<>();
        for (AttendanceRecord record : attendance) {
            if (!seen.add(record.studentId())) {
                throw new BusinessException(ErrorCode.INVALID_INPUT,
                        String.format("Student %d is listed twice", record.studentId()));
            }
        }
    }

    /**
     * 패턴의 시간대로 수업 생성 (학생 출석은 SCHEDULED 로 시작)
     */
    public static LessonOccurrence fromPattern(RecurringPattern pattern, LessonSlot slot,
                                               Collection<Long> studentIds) {
        return new LessonOccurrence(null, pattern.studioId(), pattern.teacherId(), pattern.roomId(),
                pattern.id(), slot.date(), slot.startTime(), slot.endTime(), slot.date(),
                LessonStatus.SCHEDULED, false, null, null, seedAttendance(studentIds), null);
    }

    /**
     * 패턴 없이 단건 수업 생성
     */
    public static LessonOccurrence oneOff(Long studioId, Long teacherId, Long roomId, LocalDate lessonDate,
                                          LocalTime startTime, int durationMinutes, String notes,
                                          Collection<Long> studentIds) {
        if (startTime == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Start time cannot be null");
        }
        return new LessonOccurrence(null, studioId, teacherId, roomId, null, lessonDate, startTime,
                endOf(startTime, durationMinutes), null, LessonStatus.SCHEDULED, false, null, notes,
                seedAttendance(studentIds), null);
    }

    /**
     * 시작 시각 + 길이로 종료 시각 계산 (자정을 넘기면 거부)
     */
    public static LocalTime endOf(LocalTime startTime, int durationMinutes) {
        if (durationMinutes < RecurringPattern.MIN_DURATION_MINUTES
                || durationMinutes > RecurringPattern.MAX_DURATION_MINUTES) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, String.format(
                    "Duration must be between %d and %d minutes: %d",
                    RecurringPattern.MIN_DURATION_MINUTES, RecurringPattern.MAX_DURATION_MINUTES,
                    durationMinutes));
        }
        LocalTime end = startTime.plusMinutes(durationMinutes);
        if (!end.isAfter(startTime)) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, String.format(
                    "Lesson starting at %s with %d minutes runs past midnight", startTime, durationMinutes));
        }
        return end;
    }

    private static List<AttendanceRecord> seedAttendance(Collection<Long> studentIds) {
        if (studentIds == null) {
            return List.of();
        }
        return new LinkedHashSet<>(studentIds).stream()
                .sorted()
                .map(AttendanceRecord::scheduled)
                .toList();
    }

    public Set<Long> studentIds() {
        return attendance.stream()
                .map(AttendanceRecord::studentId)
                .collect(Collectors.toUnmodifiableSet());
    }

    public int durationMinutes() {
        return (int) Duration.between(startTime, endTime).toMinutes();
    }

    public boolean isGenerated() {
        return patternId != null;
    }

    /**
     * 취소된 수업은 자원을 점유하지 않는다
     */
    public boolean occupiesResources() {
        return status != LessonStatus.CANCELLED;
    }

    /**
     * 패턴 변경을 그대로 따라가는 수업인지 (패턴 생성 + 개별 변경 없음 + 예정 상태)
     */
    public boolean followsPattern() {
        return isGenerated() && !exception && status == LessonStatus.SCHEDULED;
    }

    public boolean isSameLessonAs(LessonOccurrence other) {
        return id != null && id.equals(other.id);
    }

    /**
     * 같은 날짜에 [start, end) 구간이 겹치는지
     */
    public boolean overlaps(LessonOccurrence other) {
        return lessonDate.equals(other.lessonDate)
                && startTime.isBefore(other.endTime)
                && other.startTime.isBefore(endTime);
    }

    /**
     * 패턴의 새 템플릿(강의실/시간/학생)으로 이동
     * 남아 있는 학생의 출석 상태는 유지하고, 새 학생은 SCHEDULED 로 추가
     */
    public LessonOccurrence followTemplate(Long newRoomId, LocalTime newStartTime, LocalTime newEndTime,
                                           Collection<Long> newStudentIds) {
        Map<Long, AttendanceRecord> current = attendance.stream()
                .collect(Collectors.toMap(AttendanceRecord::studentId, Function.identity()));
        List<AttendanceRecord> updated = new ArrayList<>();
        new LinkedHashSet<>(newStudentIds).stream()
                .sorted()
                .forEach(studentId -> updated.add(
                        current.getOrDefault(studentId, AttendanceRecord.scheduled(studentId))));
        return new LessonOccurrence(id, studioId, teacherId, newRoomId, patternId, lessonDate, newStartTime,
                newEndTime, originalDate, status, exception, cancellationReason, notes, updated, version);
    }

    /**
     * 개별 일정 변경 (날짜/시간/강의실)
     * 예정 상태에서만 가능하며, 패턴 수업이면 예외 플래그가 붙는다
     */
    public LessonOccurrence reschedule(LocalDate newDate, LocalTime newStartTime, LocalTime newEndTime,
                                       Long newRoomId) {
        if (status != LessonStatus.SCHEDULED) {
            throw new InvalidLessonStatusException(id, status, "rescheduled");
        }
        return new LessonOccurrence(id, studioId, teacherId, newRoomId, patternId, newDate, newStartTime,
                newEndTime, originalDate, status, exception || isGenerated(), cancellationReason, notes,
                attendance, version);
    }

    /**
     * 상태 변경
     * 이미 취소된 수업을 다시 취소하면 그대로 반환한다
     */
    public LessonOccurrence changeStatus(LessonStatus target, String reason) {
        if (status == LessonStatus.CANCELLED && target == LessonStatus.CANCELLED) {
            return this;
        }
        if (!status.canTransitionTo(target)) {
            throw new InvalidLessonStatusException(id, status, target);
        }
        String newReason = target == LessonStatus.CANCELLED ? reason : null;
        List<AttendanceRecord> newAttendance = switch (target) {
            case CANCELLED -> replaceAttendance(AttendanceStatus.SCHEDULED, AttendanceStatus.CANCELLED);
            case SCHEDULED -> replaceAttendance(AttendanceStatus.CANCELLED, AttendanceStatus.SCHEDULED);
            default -> attendance;
        };
        return new LessonOccurrence(id, studioId, teacherId, roomId, patternId, lessonDate, startTime, endTime,
                originalDate, target, exception, newReason, notes, newAttendance, version);
    }

    /**
     * 개별 변경으로 취소 (패턴 수업이면 예외 플래그가 붙는다)
     */
    public LessonOccurrence cancelAsException(String reason) {
        LessonOccurrence cancelled = changeStatus(LessonStatus.CANCELLED, reason);
        return cancelled.asException();
    }

    /**
     * 패턴 수업이면 예외 플래그를 붙인다
     */
    public LessonOccurrence asException() {
        if (!isGenerated() || exception) {
            return this;
        }
        return new LessonOccurrence(id, studioId, teacherId, roomId, patternId, lessonDate, startTime, endTime,
                originalDate, status, true, cancellationReason, notes, attendance, version);
    }

    private List<AttendanceRecord> replaceAttendance(AttendanceStatus from, AttendanceStatus to) {
        return attendance.stream()
                .map(record -> record.status() == from ? record.withStatus(to) : record)
                .toList();
    }

    /**
     * 학생 1명의 출석 상태 변경
     */
    public LessonOccurrence markAttendance(Long studentId, AttendanceStatus attendanceStatus) {
        if (attendance.stream().noneMatch(record -> record.studentId().equals(studentId))) {
            throw new AttendanceNotFoundException(id, studentId);
        }
        List<AttendanceRecord> updated = attendance.stream()
                .map(record -> record.studentId().equals(studentId) ? record.withStatus(attendanceStatus) : record)
                .toList();
        return new LessonOccurrence(id, studioId, teacherId, roomId, patternId, lessonDate, startTime, endTime,
                originalDate, status, exception, cancellationReason, notes, updated, version);
    }

    public LessonOccurrence withNotes(String newNotes) {
        return new LessonOccurrence(id, studioId, teacherId, roomId, patternId, lessonDate, startTime, endTime,
                originalDate, status, exception, cancellationReason, newNotes, attendance, version);
    }
}
