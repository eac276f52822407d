package personal.studio.schedule.scheduling.adapter.in.web.dto;

import personal.studio.schedule.scheduling.domain.model.SkippedOccurrence;

import java.time.LocalDate;
import java.util.List;

/**
 * 충돌로 건너뛴 날짜 응답 DTO
 */
public record SkippedLessonResponse(
        LocalDate date,
        String reason,
        List<ConflictResponse> conflicts
) {
    public static SkippedLessonResponse from(SkippedOccurrence skipped) {
        return new SkippedLessonResponse(
                skipped.date(),
                skipped.reason(),
                skipped.conflicts().stream().map(ConflictResponse::from).toList()
        );
    }
}
