package personal.studio.schedule.scheduling.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * 같은 패턴/수업을 동시에 수정하여 낙관적 락이 실패했을 때 발생하는 예외
 * 재시도하지 않고 호출자에게 그대로 알린다.
 */
public class ConcurrentScheduleModificationException extends BusinessException {

    public ConcurrentScheduleModificationException(String target, Long id) {
        super(ErrorCode.CONCURRENT_MODIFICATION,
                String.format("%s %d was modified concurrently", target, id));
    }

    public ConcurrentScheduleModificationException(String target, Long id, Throwable cause) {
        super(ErrorCode.CONCURRENT_MODIFICATION,
                String.format("%s %d was modified concurrently", target, id), cause);
    }
}
