package personal.studio.schedule.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.studio.schedule.scheduling.application.port.in.GetScheduleUseCase;
import personal.studio.schedule.scheduling.application.port.out.LessonOccurrenceRepository;
import personal.studio.schedule.scheduling.domain.exception.InvalidDateRangeException;
import personal.studio.schedule.scheduling.domain.exception.LessonNotFoundException;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.model.StudioSchedule;

import java.time.LocalDate;
import java.util.List;

/**
 * Schedule Query Service
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ScheduleQueryService implements GetScheduleUseCase {

    private final LessonOccurrenceRepository lessonRepository;
    private final ScheduleQueryCacheService scheduleQueryCacheService;

    @Override
    public LessonOccurrence getLesson(Long lessonId) {
        return lessonRepository.findById(lessonId)
                .orElseThrow(() -> new LessonNotFoundException(lessonId));
    }

    @Override
    public StudioSchedule getStudioSchedule(Long studioId, LocalDate from, LocalDate to) {
        validateRange(from, to);
        return scheduleQueryCacheService.findStudioSchedule(studioId, from, to);
    }

    @Override
    public List<LessonOccurrence> getTeacherSchedule(Long teacherId, LocalDate from, LocalDate to) {
        validateRange(from, to);
        return lessonRepository.findByTeacher(teacherId, from, to);
    }

    @Override
    public List<LessonOccurrence> getStudentSchedule(Long studentId, LocalDate from, LocalDate to) {
        validateRange(from, to);
        return lessonRepository.findByStudent(studentId, from, to);
    }

    private void validateRange(LocalDate from, LocalDate to) {
        if (to.isBefore(from)) {
            throw new InvalidDateRangeException(from, to);
        }
    }
}
