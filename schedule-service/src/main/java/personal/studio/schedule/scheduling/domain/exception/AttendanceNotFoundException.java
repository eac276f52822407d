package personal.studio.schedule.scheduling.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * 수업에 등록되지 않은 학생의 출석을 처리하려 할 때 발생하는 예외
 */
public class AttendanceNotFoundException extends BusinessException {

    public AttendanceNotFoundException(Long lessonId, Long studentId) {
        super(ErrorCode.ATTENDANCE_NOT_FOUND,
                String.format("Student %d is not enrolled in lesson %d", studentId, lessonId));
    }
}
