package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;

/**
 * Create Lesson Exception Use Case (Input Port)
 * 수업 1건만 패턴과 다르게 변경
 */
public interface CreateLessonExceptionUseCase {

    LessonOccurrence createException(LessonExceptionCommand command);
}
