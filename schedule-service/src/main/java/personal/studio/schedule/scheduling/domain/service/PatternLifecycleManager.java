package personal.studio.schedule.scheduling.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.studio.schedule.scheduling.application.config.ScheduleProperties;
import personal.studio.schedule.scheduling.application.port.in.CreatePatternCommand;
import personal.studio.schedule.scheduling.application.port.in.UpdatePatternCommand;
import personal.studio.schedule.scheduling.application.port.out.LessonOccurrenceRepository;
import personal.studio.schedule.scheduling.application.port.out.RecurringPatternRepository;
import personal.studio.schedule.scheduling.domain.exception.ConcurrentScheduleModificationException;
import personal.studio.schedule.scheduling.domain.exception.PatternNotFoundException;
import personal.studio.schedule.scheduling.domain.exception.UpdateConflictException;
import personal.studio.schedule.scheduling.domain.model.ConflictDescriptor;
import personal.studio.schedule.scheduling.domain.model.ForcePolicy;
import personal.studio.schedule.scheduling.domain.model.GenerationResult;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.model.PatternCreationResult;
import personal.studio.schedule.scheduling.domain.model.PatternUpdateResult;
import personal.studio.schedule.scheduling.domain.model.RecurringPattern;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pattern Lifecycle Manager (Domain Service)
 * 반복 패턴 등록/변경/삭제와 그에 따른 수업 정리를 하나의 트랜잭션으로 수행
 * 낙관적 락 실패는 커밋 시점에 발생하므로 RecurringPatternService 에서 변환한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PatternLifecycleManager {

    private final RecurringPatternRepository patternRepository;
    private final LessonOccurrenceRepository lessonRepository;
    private final LessonGenerator lessonGenerator;
    private final ConflictDetector conflictDetector;
    private final ScheduleProperties scheduleProperties;
    private final Clock clock;

    /**
     * 패턴 등록 후 기본 범위까지 수업 생성
     */
    @Transactional
    public PatternCreationResult create(CreatePatternCommand command) {
        RecurringPattern pattern = RecurringPattern.create(
                command.studioId(),
                command.teacherId(),
                command.roomId(),
                command.dayOfWeek(),
                command.startTime(),
                command.durationMinutes(),
                command.validFrom(),
                command.validUntil(),
                command.notes());

        RecurringPattern saved = patternRepository.save(pattern);
        patternRepository.replaceStudentLinks(saved.id(), command.studentIds());

        log.info("Recurring pattern created: patternId={}, studioId={}, teacherId={}, dayOfWeek={}, startTime={}",
                saved.id(), saved.studioId(), saved.teacherId(), saved.dayOfWeek(), saved.startTime());

        GenerationResult generation = lessonGenerator.generateUpToDefaultHorizon(saved);
        return new PatternCreationResult(saved, command.studentIds(), generation);
    }

    /**
     * 패턴 변경
     * 1. 종료일 단축: 새 종료일 이후의 예정 수업(개별 변경 제외) 삭제
     * 2. 강의실/시간/길이/학생 변경: 오늘 이후 예정 수업을 새 템플릿으로 이동 (충돌 시 거부 또는 force 정책)
     *    충돌로 거부되면 아무것도 저장하지 않는다.
     * 3. 종료일 연장/재활성화: 기본 범위까지 수업 생성
     */
    @Transactional
    public PatternUpdateResult update(UpdatePatternCommand command) {
        Long patternId = command.patternId();
        RecurringPattern current = patternRepository.findById(patternId)
                .orElseThrow(() -> new PatternNotFoundException(patternId));

        if (command.expectedVersion() != null && !command.expectedVersion().equals(current.version())) {
            log.warn("Pattern version mismatch: patternId={}, expected={}, actual={}",
                    patternId, command.expectedVersion(), current.version());
            throw new ConcurrentScheduleModificationException("Recurring pattern", patternId);
        }

        Set<Long> currentStudents = patternRepository.findStudentIds(patternId);
        RecurringPattern updated = command.applyTo(current);
        boolean studentsChanged = command.changesStudents(currentStudents);
        Set<Long> newStudents = studentsChanged ? command.studentIds() : currentStudents;
        LocalDate today = LocalDate.now(clock);

        // 충돌 검사를 먼저 끝내고 나서 쓰기 시작한다
        Rescheduling rescheduling = Rescheduling.NONE;
        if (!updated.hasSameTemplateAs(current) || studentsChanged) {
            rescheduling = planForwardLessons(updated, newStudents, today, command.force());
        }

        int deleted = 0;
        if (updated.shortensValidityOf(current)) {
            deleted = deleteLessonsAfter(updated);
        }
        if (!rescheduling.moved().isEmpty()) {
            lessonRepository.saveAll(rescheduling.moved());
        }

        RecurringPattern saved = patternRepository.save(updated);
        if (studentsChanged) {
            patternRepository.replaceStudentLinks(patternId, newStudents);
        }

        GenerationResult generation = GenerationResult.empty();
        if (saved.active() && (saved.extendsValidityOf(current) || saved.isReactivationOf(current))) {
            generation = lessonGenerator.generateUpToDefaultHorizon(saved);
        }

        log.info("Recurring pattern updated: patternId={}, rescheduled={}, deleted={}, conflicts={}, generated={}",
                patternId, rescheduling.moved().size(), deleted, rescheduling.conflicts().size(), generation.createdCount());

        return new PatternUpdateResult(saved, newStudents, rescheduling.moved().size(), deleted,
                rescheduling.conflicts(), generation);
    }

    /**
     * 패턴과 생성된 수업, 학생 링크 삭제
     *
     * @return 삭제된 수업 수
     */
    @Transactional
    public int delete(Long patternId) {
        if (!patternRepository.existsById(patternId)) {
            throw new PatternNotFoundException(patternId);
        }
        int deletedLessons = lessonRepository.deleteByPatternId(patternId);
        patternRepository.delete(patternId);

        log.info("Recurring pattern deleted: patternId={}, deletedLessons={}", patternId, deletedLessons);
        return deletedLessons;
    }

    private int deleteLessonsAfter(RecurringPattern updated) {
        LocalDate boundary = updated.validUntil();
        List<Long> doomed = lessonRepository.findByPatternFrom(updated.id(), boundary.plusDays(1)).stream()
                .filter(LessonOccurrence::followsPattern)
                .map(LessonOccurrence::id)
                .toList();
        if (!doomed.isEmpty()) {
            lessonRepository.deleteAllById(doomed);
        }
        log.info("Lessons beyond new end date removed: patternId={}, validUntil={}, deleted={}",
                updated.id(), boundary, doomed.size());
        return doomed.size();
    }

    private Rescheduling planForwardLessons(RecurringPattern updated, Set<Long> studentIds,
                                            LocalDate today, boolean force) {
        List<LessonOccurrence> forward = lessonRepository.findByPatternFrom(updated.id(), today).stream()
                .filter(LessonOccurrence::followsPattern)
                .filter(lesson -> updated.coversDate(lesson.lessonDate()))
                .toList();
        if (forward.isEmpty()) {
            return Rescheduling.NONE;
        }

        LocalDate from = forward.get(0).lessonDate();
        LocalDate to = forward.get(forward.size() - 1).lessonDate();
        Set<Long> forwardIds = forward.stream().map(LessonOccurrence::id).collect(Collectors.toSet());

        Map<LocalDate, List<LessonOccurrence>> occupied = new HashMap<>();
        lessonRepository.findActiveInRange(updated.studioId(), updated.teacherId(), updated.roomId(),
                        studentIds, from, to).stream()
                .filter(lesson -> !forwardIds.contains(lesson.id()))
                .forEach(lesson -> occupied.computeIfAbsent(lesson.lessonDate(), date -> new ArrayList<>())
                        .add(lesson));

        ForcePolicy policy = scheduleProperties.forcePolicy();
        List<LessonOccurrence> moved = new ArrayList<>();
        List<ConflictDescriptor> conflicts = new ArrayList<>();

        for (LessonOccurrence lesson : forward) {
            LessonOccurrence candidate = lesson.followTemplate(
                    updated.roomId(), updated.startTime(), updated.endTime(), studentIds);
            List<LessonOccurrence> sameDay = occupied.computeIfAbsent(lesson.lessonDate(), date -> new ArrayList<>());
            Set<ConflictDescriptor> found = conflictDetector.findConflicts(candidate, sameDay);

            conflicts.addAll(found);
            if (found.isEmpty() || policy == ForcePolicy.OVERRIDE) {
                moved.add(candidate);
                sameDay.add(candidate);
            } else {
                sameDay.add(lesson);
            }
        }

        if (!conflicts.isEmpty() && !force) {
            log.warn("Pattern update rejected due to conflicts: patternId={}, conflicts={}",
                    updated.id(), conflicts.size());
            throw new UpdateConflictException(updated.id(), conflicts);
        }

        if (!conflicts.isEmpty()) {
            log.warn("Pattern updated with force: patternId={}, policy={}, conflicts={}",
                    updated.id(), policy, conflicts.size());
        }
        return new Rescheduling(moved, conflicts);
    }

    /**
     * 새 템플릿으로 옮길 수업과 보고할 충돌
     */
    private record Rescheduling(List<LessonOccurrence> moved, List<ConflictDescriptor> conflicts) {
        static final Rescheduling NONE = new Rescheduling(List.of(), List.of());
    }
}
