package personal.studio.schedule.scheduling.adapter.in.web.dto;

import personal.studio.schedule.scheduling.domain.model.PatternDetails;
import personal.studio.schedule.scheduling.domain.model.RecurringPattern;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Collection;
import java.util.List;

/**
 * 반복 패턴 응답 DTO
 */
public record PatternResponse(
        Long patternId,
        Long studioId,
        Long teacherId,
        Long roomId,
        boolean online,
        int dayOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        int durationMinutes,
        LocalDate validFrom,
        LocalDate validUntil,
        boolean active,
        String notes,
        List<Long> studentIds,
        Long generatedLessons,
        Long version
) {
    public static PatternResponse from(PatternDetails details) {
        return of(details.pattern(), details.studentIds(), details.generatedLessons());
    }

    public static PatternResponse of(RecurringPattern pattern, Collection<Long> studentIds, Long generatedLessons) {
        return new PatternResponse(
                pattern.id(),
                pattern.studioId(),
                pattern.teacherId(),
                pattern.roomId(),
                pattern.isOnline(),
                pattern.dayOfWeek(),
                pattern.startTime(),
                pattern.endTime(),
                pattern.durationMinutes(),
                pattern.validFrom(),
                pattern.validUntil(),
                pattern.active(),
                pattern.notes(),
                studentIds.stream().sorted().toList(),
                generatedLessons,
                pattern.version()
        );
    }
}
