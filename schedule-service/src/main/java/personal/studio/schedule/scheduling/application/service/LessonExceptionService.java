package personal.studio.schedule.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import personal.studio.schedule.scheduling.application.port.in.CreateLessonExceptionUseCase;
import personal.studio.schedule.scheduling.application.port.in.LessonExceptionCommand;
import personal.studio.schedule.scheduling.application.port.in.RevertLessonExceptionUseCase;
import personal.studio.schedule.scheduling.domain.exception.ConcurrentScheduleModificationException;
import personal.studio.schedule.scheduling.domain.model.GenerationResult;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.service.LessonScheduleManager;

/**
 * Lesson Exception Application Service
 * 수업 개별 변경/되돌리기
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LessonExceptionService implements
        CreateLessonExceptionUseCase,
        RevertLessonExceptionUseCase {

    private static final String LESSON = "Lesson";

    private final LessonScheduleManager lessonScheduleManager;
    private final ScheduleQueryCacheService scheduleQueryCacheService;

    @Override
    public LessonOccurrence createException(LessonExceptionCommand command) {
        log.info("Creating lesson exception: lessonId={}, cancel={}", command.lessonId(), command.cancel());
        try {
            LessonOccurrence lesson = lessonScheduleManager.createException(command);
            scheduleQueryCacheService.evictStudioSchedules();
            return lesson;
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent lesson modification detected: lessonId={}", command.lessonId(), e);
            throw new ConcurrentScheduleModificationException(LESSON, command.lessonId(), e);
        }
    }

    @Override
    public GenerationResult revertException(Long lessonId) {
        log.info("Reverting lesson exception: lessonId={}", lessonId);
        try {
            GenerationResult result = lessonScheduleManager.revertException(lessonId);
            scheduleQueryCacheService.evictStudioSchedules();
            return result;
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            log.warn("Concurrent lesson modification detected: lessonId={}", lessonId, e);
            throw new ConcurrentScheduleModificationException(LESSON, lessonId, e);
        }
    }
}
