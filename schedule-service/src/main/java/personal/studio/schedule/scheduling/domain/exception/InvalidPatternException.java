package personal.studio.schedule.scheduling.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * 반복 패턴 값이 유효하지 않을 때 발생하는 예외
 */
public class InvalidPatternException extends BusinessException {

    public InvalidPatternException(String detail) {
        super(ErrorCode.INVALID_PATTERN, detail);
    }
}
