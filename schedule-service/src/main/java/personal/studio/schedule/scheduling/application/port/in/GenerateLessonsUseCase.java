package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.schedule.scheduling.domain.model.BulkGenerationSummary;
import personal.studio.schedule.scheduling.domain.model.GenerationResult;

import java.time.LocalDate;
import java.util.List;

/**
 * Generate Lessons Use Case (Input Port)
 */
public interface GenerateLessonsUseCase {

    /**
     * 패턴 1개를 horizonEnd 까지 생성
     */
    GenerationResult generateLessons(Long patternId, LocalDate horizonEnd);

    /**
     * 학원의 활성 패턴 중 기본 범위까지 채워지지 않은 패턴을 생성
     * 패턴마다 별도 트랜잭션이며, 실패한 패턴은 집계만 하고 계속 진행한다.
     */
    BulkGenerationSummary topUpStudio(Long studioId);

    /**
     * 활성 패턴이 있는 학원 목록 (야간 생성 대상)
     */
    List<Long> findStudiosToGenerate();
}
