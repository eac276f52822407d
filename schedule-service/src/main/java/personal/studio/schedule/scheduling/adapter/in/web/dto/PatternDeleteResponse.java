package personal.studio.schedule.scheduling.adapter.in.web.dto;

public record PatternDeleteResponse(
        Long patternId,
        int deletedLessons
) {
}
