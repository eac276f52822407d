package personal.studio.schedule.scheduling.application.port.in;

/**
 * Delete Pattern Use Case (Input Port)
 */
public interface DeletePatternUseCase {

    /**
     * @return 함께 삭제된 수업 수
     */
    int deletePattern(Long patternId);
}
