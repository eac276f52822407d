package personal.studio.schedule.scheduling.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * 반복 패턴을 찾을 수 없을 때 발생하는 예외
 */
public class PatternNotFoundException extends BusinessException {

    public PatternNotFoundException(Long patternId) {
        super(ErrorCode.PATTERN_NOT_FOUND, String.format("Recurring pattern not found: %d", patternId));
    }
}
