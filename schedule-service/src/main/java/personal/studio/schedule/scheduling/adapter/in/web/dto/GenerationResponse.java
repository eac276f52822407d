package personal.studio.schedule.scheduling.adapter.in.web.dto;

import personal.studio.schedule.scheduling.domain.model.GenerationResult;

import java.util.List;

/**
 * 수업 생성 결과 응답 DTO
 */
public record GenerationResponse(
        int createdCount,
        int skippedCount,
        List<LessonResponse> created,
        List<SkippedLessonResponse> skipped
) {
    public static GenerationResponse from(GenerationResult result) {
        return new GenerationResponse(
                result.createdCount(),
                result.skippedCount(),
                LessonResponse.fromAll(result.created()),
                result.skipped().stream().map(SkippedLessonResponse::from).toList()
        );
    }
}
