package personal.studio.schedule.scheduling.application.port.in;

import personal.studio.schedule.scheduling.domain.model.ConflictDescriptor;

import java.util.List;

/**
 * Check Conflict Use Case (Input Port)
 */
public interface CheckConflictUseCase {

    /**
     * 아무것도 저장하지 않고 충돌 목록만 반환한다. 충돌이 없으면 빈 목록.
     */
    List<ConflictDescriptor> checkConflicts(CheckConflictCommand command);
}
