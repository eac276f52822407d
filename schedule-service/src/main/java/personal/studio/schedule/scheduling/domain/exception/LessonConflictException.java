package personal.studio.schedule.scheduling.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;
import personal.studio.schedule.scheduling.domain.model.ConflictDescriptor;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * 수업 1건의 시간/강의실이 다른 수업과 겹칠 때 발생하는 예외
 */
public class LessonConflictException extends BusinessException {

    private final List<ConflictDescriptor> conflicts;

    public LessonConflictException(LocalDate date, Collection<ConflictDescriptor> conflicts) {
        super(ErrorCode.LESSON_CONFLICT,
                String.format("Lesson on %s conflicts with %d existing booking(s)", date, conflicts.size()));
        this.conflicts = List.copyOf(conflicts);
    }

    public List<ConflictDescriptor> getConflicts() {
        return conflicts;
    }

    @Override
    public List<String> getDetails() {
        return conflicts.stream().map(ConflictDescriptor::describe).toList();
    }
}
