package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.model.StudioSchedule;

import java.time.LocalDate;
import java.util.List;

/**
 * Get Schedule Use Case (Input Port)
 */
public interface GetScheduleUseCase {

    LessonOccurrence getLesson(Long lessonId);

    StudioSchedule getStudioSchedule(Long studioId, LocalDate from, LocalDate to);

    List<LessonOccurrence> getTeacherSchedule(Long teacherId, LocalDate from, LocalDate to);

    List<LessonOccurrence> getStudentSchedule(Long studentId, LocalDate from, LocalDate to);
}
