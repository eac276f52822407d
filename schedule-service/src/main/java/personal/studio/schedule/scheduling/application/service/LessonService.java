package personal.studio.schedule.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import personal.studio.schedule.scheduling.application.port.in.ChangeLessonStatusCommand;
import personal.studio.schedule.scheduling.application.port.in.CreateLessonCommand;
import personal.studio.schedule.scheduling.application.port.in.CreateLessonUseCase;
import personal.studio.schedule.scheduling.application.port.in.MarkAttendanceCommand;
import personal.studio.schedule.scheduling.application.port.in.UpdateLessonUseCase;
import personal.studio.schedule.scheduling.domain.exception.ConcurrentScheduleModificationException;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.service.LessonScheduleManager;

/**
 * Lesson Application Service
 * 단건 수업 등록, 상태 변경, 출석 체크, 삭제
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LessonService implements
        CreateLessonUseCase,
        UpdateLessonUseCase {

    private static final String LESSON = "Lesson";

    private final LessonScheduleManager lessonScheduleManager;
    private final ScheduleQueryCacheService scheduleQueryCacheService;

    @Override
    public LessonOccurrence createLesson(CreateLessonCommand command) {
        log.info("Creating one-off lesson: studioId={}, teacherId={}, date={}, startTime={}",
                command.studioId(), command.teacherId(), command.lessonDate(), command.startTime());
        LessonOccurrence lesson = lessonScheduleManager.createLesson(command);
        scheduleQueryCacheService.evictStudioSchedules();
        return lesson;
    }

    @Override
    public LessonOccurrence changeStatus(ChangeLessonStatusCommand command) {
        log.info("Changing lesson status: lessonId={}, status={}", command.lessonId(), command.status());
        try {
            LessonOccurrence lesson = lessonScheduleManager.changeStatus(command);
            scheduleQueryCacheService.evictStudioSchedules();
            return lesson;
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent lesson modification detected: lessonId={}", command.lessonId(), e);
            throw new ConcurrentScheduleModificationException(LESSON, command.lessonId(), e);
        }
    }

    @Override
    public LessonOccurrence markAttendance(MarkAttendanceCommand command) {
        try {
            LessonOccurrence lesson = lessonScheduleManager.markAttendance(command);
            scheduleQueryCacheService.evictStudioSchedules();
            return lesson;
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent attendance update detected: lessonId={}, studentId={}",
                    command.lessonId(), command.studentId(), e);
            throw new ConcurrentScheduleModificationException(LESSON, command.lessonId(), e);
        }
    }

    @Override
    public void deleteLesson(Long lessonId) {
        log.info("Deleting lesson: lessonId={}", lessonId);
        try {
            lessonScheduleManager.deleteLesson(lessonId);
            scheduleQueryCacheService.evictStudioSchedules();
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent lesson deletion detected: lessonId={}", lessonId, e);
            throw new ConcurrentScheduleModificationException(LESSON, lessonId, e);
        }
    }
}
