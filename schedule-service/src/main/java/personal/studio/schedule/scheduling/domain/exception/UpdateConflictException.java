package personal.studio.schedule.scheduling.domain.exception;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;
import personal.studio.schedule.scheduling.domain.model.ConflictDescriptor;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 패턴 변경으로 기존 수업을 옮길 때 충돌이 생기면 발생하는 예외
 * 아무것도 저장되지 않은 상태에서 던져진다.
 */
public class UpdateConflictException extends BusinessException {

    private final Long patternId;
    private final List<ConflictDescriptor> conflicts;

    public UpdateConflictException(Long patternId, Collection<ConflictDescriptor> conflicts) {
        super(ErrorCode.PATTERN_UPDATE_CONFLICT, String.format(
                "Updating pattern %d conflicts with existing lessons on %s",
                patternId, conflictDates(conflicts)));
        this.patternId = patternId;
        this.conflicts = List.copyOf(conflicts);
    }

    private static Set<LocalDate> conflictDates(Collection<ConflictDescriptor> conflicts) {
        return conflicts.stream()
                .map(ConflictDescriptor::date)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public Long getPatternId() {
        return patternId;
    }

    public List<ConflictDescriptor> getConflicts() {
        return conflicts;
    }

    public Set<LocalDate> getConflictDates() {
        return conflictDates(conflicts);
    }

    @Override
    public List<String> getDetails() {
        return conflicts.stream().map(ConflictDescriptor::describe).toList();
    }
}
