package personal.studio.schedule.scheduling.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * 예외 처리(개별 변경) 요청이 수업에 적용될 수 없을 때 발생하는 예외
 * 예: 패턴에서 생성되지 않은 수업을 되돌리려는 경우
 */
public class InvalidLessonExceptionException extends BusinessException {

    public InvalidLessonExceptionException(String detail) {
        super(ErrorCode.INVALID_LESSON_EXCEPTION, detail);
    }
}
