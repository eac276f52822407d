package personal.studio.schedule.scheduling.adapter.in.web.dto;

import personal.studio.schedule.scheduling.domain.model.AttendanceRecord;
import personal.studio.schedule.scheduling.domain.model.AttendanceStatus;

public record AttendanceResponse(
        Long studentId,
        AttendanceStatus status
) {
    public static AttendanceResponse from(AttendanceRecord record) {
        return new AttendanceResponse(record.studentId(), record.status());
    }
}
