package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;

/**
 * Update Lesson Use Case (Input Port)
 * 상태 변경, 출석 체크, 삭제
 */
public interface UpdateLessonUseCase {

    LessonOccurrence changeStatus(ChangeLessonStatusCommand command);

    LessonOccurrence markAttendance(MarkAttendanceCommand command);

    void deleteLesson(Long lessonId);
}
