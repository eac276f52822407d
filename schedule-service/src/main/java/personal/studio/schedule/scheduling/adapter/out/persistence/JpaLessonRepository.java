package personal.studio.schedule.scheduling.adapter.out.persistence;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.studio.schedule.scheduling.domain.model.LessonStatus;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA Repository for Lesson
 * 목록 조회는 출석 학생까지 fetch join 한다.
 */
public interface JpaLessonRepository extends JpaRepository<LessonEntity, Long> {

    @EntityGraph(attributePaths = "students")
    Optional<LessonEntity> findWithStudentsById(Long id);

    /**
     * 학원 내 기간 안에서 강사/강의실/학생 중 하나라도 겹치는 수업 (excluded 상태 제외)
     * roomId 가 없으면 -1, 학생이 없으면 [-1] 을 넘긴다.
     */
    @Query("""
            SELECT DISTINCT l FROM LessonEntity l
            LEFT JOIN FETCH l.students
            WHERE l.studioId = :studioId
              AND l.lessonDate BETWEEN :from AND :to
              AND l.status <> :excluded
              AND (l.teacherId = :teacherId
                   OR l.roomId = :roomId
                   OR EXISTS (SELECT 1 FROM LessonStudentEntity s
                              WHERE s.lesson = l AND s.studentId IN :studentIds))
            ORDER BY l.lessonDate, l.startTime
            """)
    List<LessonEntity> findOccupyingInRange(@Param("studioId") Long studioId,
                                            @Param("teacherId") Long teacherId,
                                            @Param("roomId") Long roomId,
                                            @Param("studentIds") Collection<Long> studentIds,
                                            @Param("from") LocalDate from,
                                            @Param("to") LocalDate to,
                                            @Param("excluded") LessonStatus excluded);

    @Query("""
            SELECT DISTINCT l FROM LessonEntity l
            LEFT JOIN FETCH l.students
            WHERE l.patternId = :patternId AND l.lessonDate >= :from
            ORDER BY l.lessonDate
            """)
    List<LessonEntity> findByPatternFrom(@Param("patternId") Long patternId, @Param("from") LocalDate from);

    @Query("""
            SELECT l.originalDate FROM LessonEntity l
            WHERE l.patternId = :patternId AND l.originalDate BETWEEN :from AND :to
            """)
    List<LocalDate> findOriginalDates(@Param("patternId") Long patternId,
                                      @Param("from") LocalDate from,
                                      @Param("to") LocalDate to);

    @EntityGraph(attributePaths = "students")
    List<LessonEntity> findByPatternId(Long patternId);

    long countByPatternId(Long patternId);

    @Query("""
            SELECT DISTINCT l FROM LessonEntity l
            LEFT JOIN FETCH l.students
            WHERE l.studioId = :studioId AND l.lessonDate BETWEEN :from AND :to
            ORDER BY l.lessonDate, l.startTime
            """)
    List<LessonEntity> findByStudioInRange(@Param("studioId") Long studioId,
                                           @Param("from") LocalDate from,
                                           @Param("to") LocalDate to);

    @Query("""
            SELECT DISTINCT l FROM LessonEntity l
            LEFT JOIN FETCH l.students
            WHERE l.teacherId = :teacherId AND l.lessonDate BETWEEN :from AND :to
            ORDER BY l.lessonDate, l.startTime
            """)
    List<LessonEntity> findByTeacherInRange(@Param("teacherId") Long teacherId,
                                            @Param("from") LocalDate from,
                                            @Param("to") LocalDate to);

    @Query("""
            SELECT DISTINCT l FROM LessonEntity l
            LEFT JOIN FETCH l.students
            WHERE l.lessonDate BETWEEN :from AND :to
              AND EXISTS (SELECT 1 FROM LessonStudentEntity s WHERE s.lesson = l AND s.studentId = :studentId)
            ORDER BY l.lessonDate, l.startTime
            """)
    List<LessonEntity> findByStudentInRange(@Param("studentId") Long studentId,
                                            @Param("from") LocalDate from,
                                            @Param("to") LocalDate to);
}
