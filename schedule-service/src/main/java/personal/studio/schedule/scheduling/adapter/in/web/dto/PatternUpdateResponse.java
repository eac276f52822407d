package personal.studio.schedule.scheduling.adapter.in.web.dto;

import personal.studio.schedule.scheduling.domain.model.PatternUpdateResult;

import java.util.List;

/**
 * 반복 패턴 변경 응답 DTO
 */
public record PatternUpdateResponse(
        PatternResponse pattern,
        int rescheduledLessons,
        int deletedLessons,
        List<ConflictResponse> conflicts,
        GenerationResponse generation
) {
    public static PatternUpdateResponse from(PatternUpdateResult result) {
        return new PatternUpdateResponse(
                PatternResponse.of(result.pattern(), result.studentIds(), null),
                result.rescheduledLessons(),
                result.deletedLessons(),
                result.conflicts().stream().map(ConflictResponse::from).toList(),
                GenerationResponse.from(result.generation())
        );
    }
}
