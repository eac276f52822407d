package personal.studio.schedule.scheduling.domain.service;

import org.springframework.stereotype.Component;
import personal.studio.schedule.scheduling.domain.model.ConflictDescriptor;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.model.ResourceType;

import java.time.LocalTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Conflict Detector
 * 후보 수업이 기존 수업과 같은 자원(강사/강의실/학생)을 같은 시간에 쓰는지 검사 (상태 없음)
 */
@Component
public class ConflictDetector {

    /**
     * 같은 날짜 + [start, end) 구간이 겹치고 + 자원을 공유하면 충돌.
     * 한 쌍에 대해 공유하는 자원 종류마다 하나씩 반환한다.
     * 자기 자신(같은 id)과 취소된 수업은 충돌로 보지 않는다.
     */
    public Set<ConflictDescriptor> findConflicts(LessonOccurrence candidate, Collection<LessonOccurrence> existing) {
        Set<ConflictDescriptor> conflicts = new LinkedHashSet<>();
        if (existing == null || !candidate.occupiesResources()) {
            return conflicts;
        }

        for (LessonOccurrence other : existing) {
            if (other.isSameLessonAs(candidate) || !other.occupiesResources() || !candidate.overlaps(other)) {
                continue;
            }

            LocalTime overlapStart = max(candidate.startTime(), other.startTime());
            LocalTime overlapEnd = min(candidate.endTime(), other.endTime());

            if (candidate.teacherId().equals(other.teacherId())) {
                conflicts.add(descriptor(ResourceType.TEACHER, Set.of(candidate.teacherId()), other,
                        overlapStart, overlapEnd));
            }
            if (candidate.roomId() != null && candidate.roomId().equals(other.roomId())) {
                conflicts.add(descriptor(ResourceType.ROOM, Set.of(candidate.roomId()), other,
                        overlapStart, overlapEnd));
            }
            Set<Long> sharedStudents = new HashSet<>(candidate.studentIds());
            sharedStudents.retainAll(other.studentIds());
            if (!sharedStudents.isEmpty()) {
                conflicts.add(descriptor(ResourceType.STUDENT, sharedStudents, other, overlapStart, overlapEnd));
            }
        }
        return conflicts;
    }

    private ConflictDescriptor descriptor(ResourceType type, Set<Long> resourceIds, LessonOccurrence other,
                                          LocalTime overlapStart, LocalTime overlapEnd) {
        return new ConflictDescriptor(type, resourceIds, other.id(), other.lessonDate(), overlapStart, overlapEnd);
    }

    private static LocalTime max(LocalTime a, LocalTime b) {
        return a.isAfter(b) ? a : b;
    }

    private static LocalTime min(LocalTime a, LocalTime b) {
        return a.isBefore(b) ? a : b;
    }
}
