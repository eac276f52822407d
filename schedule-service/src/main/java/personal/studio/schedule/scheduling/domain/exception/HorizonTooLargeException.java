package personal.studio.schedule.scheduling.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * 생성 범위가 허용된 최대 범위를 넘을 때 발생하는 예외
 */
public class HorizonTooLargeException extends BusinessException {

    public HorizonTooLargeException(LocalDate horizonEnd, LocalDate maxHorizonEnd) {
        super(ErrorCode.HORIZON_TOO_LARGE,
                String.format("Horizon end %s exceeds the maximum %s", horizonEnd, maxHorizonEnd));
    }
}
