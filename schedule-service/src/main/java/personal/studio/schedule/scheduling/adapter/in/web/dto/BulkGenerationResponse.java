package personal.studio.schedule.scheduling.adapter.in.web.dto;

import personal.studio.schedule.scheduling.domain.model.BulkGenerationSummary;

/**
 * 학원 단위 일괄 생성 응답 DTO
 */
public record BulkGenerationResponse(
        Long studioId,
        int patterns,
        int created,
        int skipped,
        int failed
) {
    public static BulkGenerationResponse of(Long studioId, BulkGenerationSummary summary) {
        return new BulkGenerationResponse(studioId, summary.patterns(), summary.created(),
                summary.skipped(), summary.failed());
    }
}
