package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.schedule.scheduling.domain.model.PatternUpdateResult;

/**
 * Update Pattern Use Case (Input Port)
 */
public interface UpdatePatternUseCase {

    PatternUpdateResult updatePattern(UpdatePatternCommand command);

    /**
     * 비활성화 (기존 수업은 유지, 새 수업은 생성하지 않음)
     */
    PatternUpdateResult deactivatePattern(Long patternId);
}
