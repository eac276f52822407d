package personal.studio.schedule.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.studio.schedule.scheduling.application.port.in.CreatePatternCommand;
import personal.studio.schedule.scheduling.application.port.in.CreatePatternUseCase;
import personal.studio.schedule.scheduling.application.port.in.DeletePatternUseCase;
import personal.studio.schedule.scheduling.application.port.in.GetPatternUseCase;
import personal.studio.schedule.scheduling.application.port.in.UpdatePatternCommand;
import personal.studio.schedule.scheduling.application.port.in.UpdatePatternUseCase;
import personal.studio.schedule.scheduling.application.port.out.LessonOccurrenceRepository;
import personal.studio.schedule.scheduling.application.port.out.RecurringPatternRepository;
import personal.studio.schedule.scheduling.domain.exception.ConcurrentScheduleModificationException;
import personal.studio.schedule.scheduling.domain.exception.PatternNotFoundException;
import personal.studio.schedule.scheduling.domain.model.PatternCreationResult;
import personal.studio.schedule.scheduling.domain.model.PatternDetails;
import personal.studio.schedule.scheduling.domain.model.PatternUpdateResult;
import personal.studio.schedule.scheduling.domain.model.RecurringPattern;
import personal.studio.schedule.scheduling.domain.service.PatternLifecycleManager;

import java.util.List;

/**
 * Recurring Pattern Application Service
 * 트랜잭션은 PatternLifecycleManager 가 담당하고,
 * 여기서는 커밋 시점의 낙관적 락/유니크 제약 위반을 도메인 예외로 변환하고 캐시를 비운다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecurringPatternService implements
        CreatePatternUseCase,
        UpdatePatternUseCase,
        DeletePatternUseCase,
        GetPatternUseCase {

    private static final String PATTERN = "Recurring pattern";

    private final PatternLifecycleManager patternLifecycleManager;
    private final RecurringPatternRepository patternRepository;
    private final LessonOccurrenceRepository lessonRepository;
    private final ScheduleQueryCacheService scheduleQueryCacheService;

    @Override
    public PatternCreationResult createPattern(CreatePatternCommand command) {
        log.info("Creating recurring pattern: studioId={}, teacherId={}, dayOfWeek={}, startTime={}",
                command.studioId(), command.teacherId(), command.dayOfWeek(), command.startTime());

        PatternCreationResult result = patternLifecycleManager.create(command);
        scheduleQueryCacheService.evictStudioSchedules();
        return result;
    }

    @Override
    public PatternUpdateResult updatePattern(UpdatePatternCommand command) {
        log.info("Updating recurring pattern: patternId={}, force={}", command.patternId(), command.force());
        try {
            PatternUpdateResult result = patternLifecycleManager.update(command);
            scheduleQueryCacheService.evictStudioSchedules();
            return result;
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            log.warn("Concurrent pattern modification detected: patternId={}", command.patternId(), e);
            throw new ConcurrentScheduleModificationException(PATTERN, command.patternId(), e);
        }
    }

    @Override
    public PatternUpdateResult deactivatePattern(Long patternId) {
        return updatePattern(UpdatePatternCommand.deactivate(patternId));
    }

    @Override
    public int deletePattern(Long patternId) {
        log.info("Deleting recurring pattern: patternId={}", patternId);
        try {
            int deletedLessons = patternLifecycleManager.delete(patternId);
            scheduleQueryCacheService.evictStudioSchedules();
            return deletedLessons;
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent pattern deletion detected: patternId={}", patternId, e);
            throw new ConcurrentScheduleModificationException(PATTERN, patternId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public PatternDetails getPattern(Long patternId) {
        RecurringPattern pattern = patternRepository.findById(patternId)
                .orElseThrow(() -> new PatternNotFoundException(patternId));
        return details(pattern);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PatternDetails> getPatternsByStudio(Long studioId, boolean activeOnly) {
        return patternRepository.findByStudio(studioId, activeOnly).stream()
                .map(this::details)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<PatternDetails> getPatternsByTeacher(Long teacherId, boolean activeOnly) {
        return patternRepository.findByTeacher(teacherId, activeOnly).stream()
                .map(this::details)
                .toList();
    }

    private PatternDetails details(RecurringPattern pattern) {
        return new PatternDetails(pattern,
                patternRepository.findStudentIds(pattern.id()),
                lessonRepository.countByPattern(pattern.id()));
    }
}
