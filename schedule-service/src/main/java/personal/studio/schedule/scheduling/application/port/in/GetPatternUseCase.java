package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.schedule.scheduling.domain.model.PatternDetails;

import java.util.List;

/**
 * Get Pattern Use Case (Input Port)
 */
public interface GetPatternUseCase {

    PatternDetails getPattern(Long patternId);

    List<PatternDetails> getPatternsByStudio(Long studioId, boolean activeOnly);

    List<PatternDetails> getPatternsByTeacher(Long teacherId, boolean activeOnly);
}
