package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;

/**
 * Create Lesson Use Case (Input Port)
 * 패턴 없는 단건 수업 등록
 */
public interface CreateLessonUseCase {

    LessonOccurrence createLesson(CreateLessonCommand command);
}
