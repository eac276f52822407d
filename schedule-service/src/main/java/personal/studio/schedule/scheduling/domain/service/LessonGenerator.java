package personal.studio.schedule.scheduling.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import personal.studio.schedule.scheduling.application.config.ScheduleProperties;
import personal.studio.schedule.scheduling.application.port.out.LessonOccurrenceRepository;
import personal.studio.schedule.scheduling.application.port.out.RecurringPatternRepository;
import personal.studio.schedule.scheduling.domain.exception.HorizonTooLargeException;
import personal.studio.schedule.scheduling.domain.exception.PatternNotFoundException;
import personal.studio.schedule.scheduling.domain.model.ConflictDescriptor;
import personal.studio.schedule.scheduling.domain.model.GenerationResult;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.model.LessonSlot;
import personal.studio.schedule.scheduling.domain.model.RecurringPattern;
import personal.studio.schedule.scheduling.domain.model.SkippedOccurrence;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Lesson Generator (Domain Service)
 * 반복 패턴을 validFrom 부터 horizonEnd 까지 실제 수업으로 생성
 *
 * - 범위 상한만 오늘 기준 (today + maxHorizonWeeks), 시작은 항상 패턴 유효 시작일
 * - 이미 생성된 원래 날짜(originalDate)는 다시 만들지 않는다 (여러 번 실행해도 중복 없음)
 * - 기존 수업 또는 같은 배치의 후보와 충돌하면 건너뛰고 사유를 남긴다
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LessonGenerator {

    private final LessonCalendar lessonCalendar;
    private final ConflictDetector conflictDetector;
    private final RecurringPatternRepository patternRepository;
    private final LessonOccurrenceRepository lessonRepository;
    private final ScheduleProperties scheduleProperties;
    private final Clock clock;

    /**
     * 패턴 ID 로 조회하여 생성
     */
    @Transactional
    public GenerationResult generate(Long patternId, LocalDate horizonEnd) {
        RecurringPattern pattern = patternRepository.findById(patternId)
                .orElseThrow(() -> new PatternNotFoundException(patternId));
        return generate(pattern, horizonEnd);
    }

    /**
     * 기본 범위 (오늘 + generationWeeks) 까지 생성
     */
    @Transactional
    public GenerationResult generateUpToDefaultHorizon(RecurringPattern pattern) {
        return generate(pattern, scheduleProperties.defaultHorizonEnd(LocalDate.now(clock)));
    }

    @Transactional
    public GenerationResult generate(RecurringPattern pattern, LocalDate horizonEnd) {
        LocalDate today = LocalDate.now(clock);
        LocalDate maxHorizonEnd = scheduleProperties.maxHorizonEnd(today);
        if (horizonEnd.isAfter(maxHorizonEnd)) {
            throw new HorizonTooLargeException(horizonEnd, maxHorizonEnd);
        }

        if (!pattern.active()) {
            log.info("Pattern is inactive, nothing to generate: patternId={}", pattern.id());
            return GenerationResult.empty();
        }

        LocalDate horizonStart = pattern.validFrom();
        if (horizonEnd.isBefore(horizonStart)) {
            log.debug("Horizon ends before pattern starts: patternId={}, validFrom={}, horizonEnd={}",
                    pattern.id(), horizonStart, horizonEnd);
            return GenerationResult.empty();
        }

        List<LessonSlot> slots = lessonCalendar.occurrencesFor(pattern, horizonStart, horizonEnd).toList();
        if (slots.isEmpty()) {
            log.debug("No slots within horizon: patternId={}, horizon={}..{}", pattern.id(), horizonStart, horizonEnd);
            return GenerationResult.empty();
        }

        LocalDate rangeStart = slots.get(0).date();
        LocalDate rangeEnd = slots.get(slots.size() - 1).date();

        Set<LocalDate> materialized = lessonRepository.findMaterializedDates(pattern.id(), rangeStart, rangeEnd);
        Set<Long> studentIds = patternRepository.findStudentIds(pattern.id());
        Map<LocalDate, List<LessonOccurrence>> occupied = groupByDate(lessonRepository.findActiveInRange(
                pattern.studioId(), pattern.teacherId(), pattern.roomId(), studentIds, rangeStart, rangeEnd));

        List<LessonOccurrence> accepted = new ArrayList<>();
        List<SkippedOccurrence> skipped = new ArrayList<>();

        for (LessonSlot slot : slots) {
            if (materialized.contains(slot.date())) {
                continue;
            }

            LessonOccurrence candidate = LessonOccurrence.fromPattern(pattern, slot, studentIds);
            List<LessonOccurrence> sameDay = occupied.computeIfAbsent(slot.date(), date -> new ArrayList<>());
            Set<ConflictDescriptor> conflicts = conflictDetector.findConflicts(candidate, sameDay);

            if (conflicts.isEmpty()) {
                accepted.add(candidate);
                sameDay.add(candidate);
            } else {
                SkippedOccurrence skip = SkippedOccurrence.conflicted(slot.date(), conflicts);
                log.warn("Skipping lesson due to conflict: patternId={}, date={}, reason={}",
                        pattern.id(), slot.date(), skip.reason());
                skipped.add(skip);
            }
        }

        List<LessonOccurrence> created = accepted.isEmpty() ? List.of() : lessonRepository.saveAll(accepted);

        log.info("Lessons generated: patternId={}, horizonEnd={}, created={}, skipped={}, alreadyPresent={}",
                pattern.id(), horizonEnd, created.size(), skipped.size(), materialized.size());

        return new GenerationResult(created, skipped);
    }

    private Map<LocalDate, List<LessonOccurrence>> groupByDate(List<LessonOccurrence> lessons) {
        return lessons.stream()
                .collect(Collectors.groupingBy(LessonOccurrence::lessonDate, HashMap::new,
                        Collectors.toCollection(ArrayList::new)));
    }
}
