package personal.studio.schedule.scheduling.application.port.out;

import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lesson Occurrence Repository Port (Output Port)
 */
public interface LessonOccurrenceRepository {

    Optional<LessonOccurrence> findById(Long lessonId);

    LessonOccurrence save(LessonOccurrence lesson);

    List<LessonOccurrence> saveAll(List<LessonOccurrence> lessons);

    void deleteById(Long lessonId);

    void deleteAllById(Collection<Long> lessonIds);

    /**
     * 패턴의 모든 수업 삭제
     *
     * @return 삭제된 수업 수
     */
    int deleteByPatternId(Long patternId);

    /**
     * 학원 내에서 기간 안에 주어진 자원(강사/강의실/학생 중 하나라도)을 점유하는 수업 조회
     * 취소된 수업은 제외한다.
     *
     * @param roomId     null 이면 강의실 조건 없음
     * @param studentIds 비어 있으면 학생 조건 없음
     */
    List<LessonOccurrence> findActiveInRange(Long studioId, Long teacherId, Long roomId, Set<Long> studentIds,
                                             LocalDate from, LocalDate to);

    /**
     * 패턴 수업 중 lessonDate >= from 인 수업 (날짜순)
     */
    List<LessonOccurrence> findByPatternFrom(Long patternId, LocalDate from);

    /**
     * 패턴이 이미 생성한 원래 날짜(originalDate) 목록
     */
    Set<LocalDate> findMaterializedDates(Long patternId, LocalDate from, LocalDate to);

    long countByPattern(Long patternId);

    List<LessonOccurrence> findByStudio(Long studioId, LocalDate from, LocalDate to);

    List<LessonOccurrence> findByTeacher(Long teacherId, LocalDate from, LocalDate to);

    List<LessonOccurrence> findByStudent(Long studentId, LocalDate from, LocalDate to);
}
