package personal.studio.schedule.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import personal.studio.common.exception.BusinessException;
import personal.studio.schedule.scheduling.application.config.ScheduleProperties;
import personal.studio.schedule.scheduling.application.port.in.GenerateLessonsUseCase;
import personal.studio.schedule.scheduling.application.port.out.RecurringPatternRepository;
import personal.studio.schedule.scheduling.domain.exception.ConcurrentScheduleModificationException;
import personal.studio.schedule.scheduling.domain.model.BulkGenerationSummary;
import personal.studio.schedule.scheduling.domain.model.GenerationResult;
import personal.studio.schedule.scheduling.domain.model.RecurringPattern;
import personal.studio.schedule.scheduling.domain.service.LessonGenerator;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Lesson Generation Application Service
 * 트랜잭션을 열지 않으므로 LessonGenerator 호출 1회가 트랜잭션 1개가 된다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LessonGenerationService implements GenerateLessonsUseCase {

    private final LessonGenerator lessonGenerator;
    private final RecurringPatternRepository patternRepository;
    private final ScheduleQueryCacheService scheduleQueryCacheService;
    private final ScheduleProperties scheduleProperties;
    private final Clock clock;

    @Override
    public GenerationResult generateLessons(Long patternId, LocalDate horizonEnd) {
        log.info("Generating lessons: patternId={}, horizonEnd={}", patternId, horizonEnd);
        try {
            GenerationResult result = lessonGenerator.generate(patternId, horizonEnd);
            if (result.createdCount() > 0) {
                scheduleQueryCacheService.evictStudioSchedules();
            }
            return result;
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            log.warn("Concurrent generation detected: patternId={}", patternId, e);
            throw new ConcurrentScheduleModificationException("Recurring pattern", patternId, e);
        }
    }

    @Override
    public BulkGenerationSummary topUpStudio(Long studioId) {
        LocalDate horizonEnd = scheduleProperties.defaultHorizonEnd(LocalDate.now(clock));
        // 생성은 originalDate 기준으로 멱등이므로 모든 활성 패턴을 다시 훑는다.
        // 되돌린 예외 수업이나 충돌이 풀린 날짜도 이때 채워진다.
        List<RecurringPattern> patterns = patternRepository.findActiveByStudio(studioId);

        BulkGenerationSummary summary = BulkGenerationSummary.empty();
        for (RecurringPattern pattern : patterns) {
            try {
                summary = summary.add(lessonGenerator.generate(pattern, horizonEnd));
            } catch (BusinessException | OptimisticLockingFailureException | DataIntegrityViolationException e) {
                log.error("Lesson generation failed: studioId={}, patternId={}", studioId, pattern.id(), e);
                summary = summary.addFailure();
            }
        }

        if (summary.created() > 0) {
            scheduleQueryCacheService.evictStudioSchedules();
        }
        log.info("Studio top-up completed: studioId={}, horizonEnd={}, patterns={}, created={}, skipped={}, failed={}",
                studioId, horizonEnd, summary.patterns(), summary.created(), summary.skipped(), summary.failed());
        return summary;
    }

    @Override
    public List<Long> findStudiosToGenerate() {
        return patternRepository.findStudioIdsWithActivePatterns();
    }
}
