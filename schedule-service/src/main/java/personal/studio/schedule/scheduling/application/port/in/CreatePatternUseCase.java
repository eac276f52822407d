package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.schedule.scheduling.domain.model.PatternCreationResult;

/**
 * Create Pattern Use Case (Input Port)
 */
public interface CreatePatternUseCase {

    /**
     * 반복 패턴 등록 후 기본 범위까지 수업 생성
     */
    PatternCreationResult createPattern(CreatePatternCommand command);
}
