package personal.studio.schedule.scheduling.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;
import personal.studio.schedule.scheduling.domain.model.LessonStatus;

/**
 * 허용되지 않는 수업 상태 전이/변경 시 발생하는 예외
 */
public class InvalidLessonStatusException extends BusinessException {

    public InvalidLessonStatusException(Long lessonId, LessonStatus from, LessonStatus to) {
        super(ErrorCode.INVALID_LESSON_STATUS,
                String.format("Lesson %d cannot change status from %s to %s", lessonId, from, to));
    }

    public InvalidLessonStatusException(Long lessonId, LessonStatus current, String action) {
        super(ErrorCode.INVALID_LESSON_STATUS,
                String.format("Lesson %d in status %s cannot be %s", lessonId, current, action));
    }
}
