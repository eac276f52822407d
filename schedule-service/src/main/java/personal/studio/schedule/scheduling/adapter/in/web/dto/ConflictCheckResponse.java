package personal.studio.schedule.scheduling.adapter.in.web.dto;

import personal.studio.schedule.scheduling.domain.model.ConflictDescriptor;

import java.util.List;

/**
 * 사전 충돌 확인 응답 DTO
 */
public record ConflictCheckResponse(
        boolean hasConflict,
        List<ConflictResponse> conflicts
) {
    public static ConflictCheckResponse from(List<ConflictDescriptor> conflicts) {
        return new ConflictCheckResponse(!conflicts.isEmpty(),
                conflicts.stream().map(ConflictResponse::from).toList());
    }
}
