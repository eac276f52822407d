package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.schedule.scheduling.domain.model.GenerationResult;

/**
 * Revert Lesson Exception Use Case (Input Port)
 */
public interface RevertLessonExceptionUseCase {

    /**
     * @return 즉시 재생성된 수업 (설정이 꺼져 있으면 빈 결과)
     */
    GenerationResult revertException(Long lessonId);
}
