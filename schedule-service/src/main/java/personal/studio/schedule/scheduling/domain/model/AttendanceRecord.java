package personal.studio.schedule.scheduling.domain.model;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * Attendance Record
 * 수업 1건에 대한 학생 1명의 출석 정보 (수업이 소유)
 */
public record AttendanceRecord(
        Long studentId,
        AttendanceStatus status
) {
    public AttendanceRecord {
        if (studentId == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Student ID cannot be null");
        }
        if (status == null) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "Attendance status cannot be null");
        }
    }

    public static AttendanceRecord scheduled(Long studentId) {
        return new AttendanceRecord(studentId, AttendanceStatus.SCHEDULED);
    }

    public AttendanceRecord withStatus(AttendanceStatus newStatus) {
        return new AttendanceRecord(studentId, newStatus);
    }
}
