package personal.studio.schedule.scheduling.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.studio.schedule.scheduling.application.config.ScheduleProperties;
import personal.studio.schedule.scheduling.application.port.in.ChangeLessonStatusCommand;
import personal.studio.schedule.scheduling.application.port.in.CreateLessonCommand;
import personal.studio.schedule.scheduling.application.port.in.LessonExceptionCommand;
import personal.studio.schedule.scheduling.application.port.in.MarkAttendanceCommand;
import personal.studio.schedule.scheduling.application.port.out.LessonOccurrenceRepository;
import personal.studio.schedule.scheduling.application.port.out.RecurringPatternRepository;
import personal.studio.schedule.scheduling.domain.exception.InvalidLessonExceptionException;
import personal.studio.schedule.scheduling.domain.exception.LessonConflictException;
import personal.studio.schedule.scheduling.domain.exception.LessonNotFoundException;
import personal.studio.schedule.scheduling.domain.model.ConflictDescriptor;
import personal.studio.schedule.scheduling.domain.model.GenerationResult;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.model.LessonStatus;
import personal.studio.schedule.scheduling.domain.model.RecurringPattern;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * Lesson Schedule Manager (Domain Service)
 * 수업 1건 단위 변경 (개별 변경/되돌리기, 단건 등록, 상태, 출석, 삭제) 트랜잭션
 * 패턴은 변경하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LessonScheduleManager {

    private final LessonOccurrenceRepository lessonRepository;
    private final RecurringPatternRepository patternRepository;
    private final ConflictDetector conflictDetector;
    private final LessonGenerator lessonGenerator;
    private final ScheduleProperties scheduleProperties;

    /**
     * 수업 1건만 일정 변경 또는 취소
     * 변경된 시간대가 다른 수업과 겹치면 LessonConflictException
     */
    @Transactional
    public LessonOccurrence createException(LessonExceptionCommand command) {
        LessonOccurrence lesson = load(command.lessonId());
        LessonOccurrence updated = lesson;

        if (command.cancel()) {
            updated = lesson.cancelAsException(command.cancellationReason());
        } else if (command.changesSlot()) {
            LocalDate date = command.lessonDate() != null ? command.lessonDate() : lesson.lessonDate();
            LocalTime start = command.startTime() != null ? command.startTime() : lesson.startTime();
            int duration = command.durationMinutes() != null ? command.durationMinutes() : lesson.durationMinutes();
            Long roomId = command.clearRoom() ? null
                    : (command.roomId() != null ? command.roomId() : lesson.roomId());

            updated = lesson.reschedule(date, start, LessonOccurrence.endOf(start, duration), roomId);
            ensureNoConflicts(updated);
        }

        if (command.notes() != null) {
            updated = updated.withNotes(command.notes()).asException();
        }

        LessonOccurrence saved = lessonRepository.save(updated);
        log.info("Lesson exception created: lessonId={}, patternId={}, date={}, startTime={}, status={}",
                saved.id(), saved.patternId(), saved.lessonDate(), saved.startTime(), saved.status());
        return saved;
    }

    /**
     * 개별 변경 되돌리기
     * 수업을 삭제하여 패턴의 원래 시간대가 다시 생성되도록 한다.
     * 설정에 따라 즉시 재생성한다.
     */
    @Transactional
    public GenerationResult revertException(Long lessonId) {
        LessonOccurrence lesson = load(lessonId);
        if (!lesson.isGenerated() || !lesson.exception()) {
            throw new InvalidLessonExceptionException(
                    String.format("Lesson %d is not a modified pattern lesson", lessonId));
        }

        lessonRepository.deleteById(lessonId);
        log.info("Lesson exception reverted: lessonId={}, patternId={}, originalDate={}",
                lessonId, lesson.patternId(), lesson.originalDate());

        if (!scheduleProperties.exception().regenerateOnRevert()) {
            return GenerationResult.empty();
        }
        return patternRepository.findById(lesson.patternId())
                .filter(RecurringPattern::active)
                .map(lessonGenerator::generateUpToDefaultHorizon)
                .orElseGet(GenerationResult::empty);
    }

    /**
     * 패턴 없는 단건 수업 등록
     */
    @Transactional
    public LessonOccurrence createLesson(CreateLessonCommand command) {
        LessonOccurrence lesson = LessonOccurrence.oneOff(
                command.studioId(),
                command.teacherId(),
                command.roomId(),
                command.lessonDate(),
                command.startTime(),
                command.durationMinutes(),
                command.notes(),
                command.studentIds());

        ensureNoConflicts(lesson);

        LessonOccurrence saved = lessonRepository.save(lesson);
        log.info("One-off lesson created: lessonId={}, studioId={}, teacherId={}, date={}, startTime={}",
                saved.id(), saved.studioId(), saved.teacherId(), saved.lessonDate(), saved.startTime());
        return saved;
    }

    /**
     * 상태 변경 (취소된 수업 복구 시 충돌 검사)
     */
    @Transactional
    public LessonOccurrence changeStatus(ChangeLessonStatusCommand command) {
        LessonOccurrence lesson = load(command.lessonId());
        LessonOccurrence updated = lesson.changeStatus(command.status(), command.reason());
        if (updated == lesson) {
            log.debug("Lesson status unchanged: lessonId={}, status={}", lesson.id(), lesson.status());
            return lesson;
        }

        if (lesson.status() == LessonStatus.CANCELLED && updated.status() == LessonStatus.SCHEDULED) {
            ensureNoConflicts(updated);
        }

        LessonOccurrence saved = lessonRepository.save(updated);
        log.info("Lesson status changed: lessonId={}, from={}, to={}", saved.id(), lesson.status(), saved.status());
        return saved;
    }

    @Transactional
    public LessonOccurrence markAttendance(MarkAttendanceCommand command) {
        LessonOccurrence lesson = load(command.lessonId());
        LessonOccurrence saved = lessonRepository.save(
                lesson.markAttendance(command.studentId(), command.status()));
        log.info("Attendance marked: lessonId={}, studentId={}, status={}",
                saved.id(), command.studentId(), command.status());
        return saved;
    }

    @Transactional
    public void deleteLesson(Long lessonId) {
        LessonOccurrence lesson = load(lessonId);
        lessonRepository.deleteById(lessonId);
        log.info("Lesson deleted: lessonId={}, patternId={}, date={}", lessonId, lesson.patternId(), lesson.lessonDate());
    }

    private LessonOccurrence load(Long lessonId) {
        return lessonRepository.findById(lessonId)
                .orElseThrow(() -> new LessonNotFoundException(lessonId));
    }

    private void ensureNoConflicts(LessonOccurrence candidate) {
        List<LessonOccurrence> sameDay = lessonRepository.findActiveInRange(candidate.studioId(),
                candidate.teacherId(), candidate.roomId(), candidate.studentIds(),
                candidate.lessonDate(), candidate.lessonDate());
        Set<ConflictDescriptor> conflicts = conflictDetector.findConflicts(candidate, sameDay);
        if (!conflicts.isEmpty()) {
            log.warn("Lesson conflicts detected: lessonId={}, date={}, conflicts={}",
                    candidate.id(), candidate.lessonDate(), conflicts.size());
            throw new LessonConflictException(candidate.lessonDate(), conflicts);
        }
    }
}
