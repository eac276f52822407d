package personal.studio.schedule.scheduling.domain.model;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Conflict Descriptor
 * 두 수업이 같은 자원을 같은 시간에 점유할 때의 충돌 정보
 *
 * @param resourceType        충돌 자원 종류
 * @param resourceIds         겹치는 자원 ID (강사/강의실은 1개, 학생은 여러 명일 수 있음)
 * @param conflictingLessonId 충돌 상대 수업 ID (같은 배치에서 아직 저장되지 않은 후보이면 null)
 * @param date                수업 날짜
 * @param overlapStart        겹치는 구간 시작
 * @param overlapEnd          겹치는 구간 끝
 */
public record ConflictDescriptor(
        ResourceType resourceType,
        Set<Long> resourceIds,
        Long conflictingLessonId,
        LocalDate date,
        LocalTime overlapStart,
        LocalTime overlapEnd
) {
    public ConflictDescriptor {
        resourceIds = Set.copyOf(resourceIds);
    }

    /**
     * 로그/응답용 한 줄 요약
     */
    public String describe() {
        String ids = resourceIds.stream()
                .sorted()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
        String against = conflictingLessonId == null ? "pending lesson" : "lesson " + conflictingLessonId;
        return String.format("%s conflict on %s %s-%s (%s %s, %s)",
                resourceType.label(), date, overlapStart, overlapEnd, resourceType.label(), ids, against);
    }
}
