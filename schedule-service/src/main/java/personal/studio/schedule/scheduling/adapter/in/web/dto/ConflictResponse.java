package personal.studio.schedule.scheduling.adapter.in.web.dto;

import personal.studio.schedule.scheduling.domain.model.ConflictDescriptor;
import personal.studio.schedule.scheduling.domain.model.ResourceType;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * 충돌 정보 응답 DTO
 */
public record ConflictResponse(
        ResourceType resourceType,
        List<Long> resourceIds,
        Long conflictingLessonId,
        LocalDate date,
        LocalTime overlapStart,
        LocalTime overlapEnd
) {
    public static ConflictResponse from(ConflictDescriptor conflict) {
        return new ConflictResponse(
                conflict.resourceType(),
                conflict.resourceIds().stream().sorted().toList(),
                conflict.conflictingLessonId(),
                conflict.date(),
                conflict.overlapStart(),
                conflict.overlapEnd()
        );
    }
}
