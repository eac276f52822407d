package personal.studio.schedule.scheduling.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

import java.time.LocalDate;

/**
 * 종료일이 시작일보다 앞설 때 발생하는 예외
 */
public class InvalidDateRangeException extends BusinessException {

    public InvalidDateRangeException(LocalDate from, LocalDate to) {
        super(ErrorCode.INVALID_DATE_RANGE, String.format("End date %s is before start date %s", to, from));
    }
}
