package personal.studio.schedule.scheduling.application.port.out;

import personal.studio.schedule.scheduling.domain.model.RecurringPattern;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recurring Pattern Repository Port (Output Port)
 * 반복 패턴 + 패턴 학생 링크 저장소
 */
public interface RecurringPatternRepository {

    Optional<RecurringPattern> findById(Long patternId);

    boolean existsById(Long patternId);

    /**
     * 저장 (id 가 있으면 version 이 일치할 때만 갱신)
     */
    RecurringPattern save(RecurringPattern pattern);

    /**
     * 패턴과 학생 링크 삭제 (수업 삭제는 LessonOccurrenceRepository 책임)
     */
    void delete(Long patternId);

    List<RecurringPattern> findActive();

    List<RecurringPattern> findActiveByStudio(Long studioId);

    List<RecurringPattern> findByStudio(Long studioId, boolean activeOnly);

    List<RecurringPattern> findByTeacher(Long teacherId, boolean activeOnly);

    /**
     * 활성 패턴이 있는 학원 ID 목록
     */
    List<Long> findStudioIdsWithActivePatterns();

    Set<Long> findStudentIds(Long patternId);

    /**
     * 패턴 학생 목록을 주어진 집합으로 교체
     */
    void replaceStudentLinks(Long patternId, Set<Long> studentIds);
}
