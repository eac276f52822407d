package personal.studio.schedule.scheduling.domain.model;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 생성 중 충돌로 건너뛴 날짜와 사유
 *
 * @param date      건너뛴 날짜
 * @param reason    사유 (예: "room conflict", "teacher conflict, student conflict")
 * @param conflicts 상세 충돌 목록
 */
public record SkippedOccurrence(
        LocalDate date,
        String reason,
        List<ConflictDescriptor> conflicts
) {
    public SkippedOccurrence {
        conflicts = List.copyOf(conflicts);
    }

    public static SkippedOccurrence conflicted(LocalDate date, Collection<ConflictDescriptor> conflicts) {
        String reason = conflicts.stream()
                .map(ConflictDescriptor::resourceType)
                .distinct()
                .sorted()
                .map(type -> type.label() + " conflict")
                .collect(Collectors.joining(", "));
        return new SkippedOccurrence(date, reason, List.copyOf(conflicts));
    }
}
