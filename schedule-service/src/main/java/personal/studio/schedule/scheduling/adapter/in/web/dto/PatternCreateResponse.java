package personal.studio.schedule.scheduling.adapter.in.web.dto;

import personal.studio.schedule.scheduling.domain.model.PatternCreationResult;

/**
 * 반복 패턴 등록 응답 DTO
 */
public record PatternCreateResponse(
        PatternResponse pattern,
        GenerationResponse generation
) {
    public static PatternCreateResponse from(PatternCreationResult result) {
        return new PatternCreateResponse(
                PatternResponse.of(result.pattern(), result.studentIds(),
                        (long) result.generation().createdCount()),
                GenerationResponse.from(result.generation())
        );
    }
}
