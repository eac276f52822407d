package personal.studio.schedule.scheduling.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * 수업을 찾을 수 없을 때 발생하는 예외
 */
public class LessonNotFoundException extends BusinessException {

    public LessonNotFoundException(Long lessonId) {
        super(ErrorCode.LESSON_NOT_FOUND, String.format("Lesson not found: %d", lessonId));
    }
}
