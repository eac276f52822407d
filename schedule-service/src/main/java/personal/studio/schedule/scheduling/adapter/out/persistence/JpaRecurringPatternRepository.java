package personal.studio.schedule.scheduling.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

/**
 * Spring Data JPA Repository for RecurringPattern
 */
public interface JpaRecurringPatternRepository extends JpaRepository<RecurringPatternEntity, Long> {

    List<RecurringPatternEntity> findByActiveTrueOrderByIdAsc();

    List<RecurringPatternEntity> findByStudioIdOrderByDayOfWeekAscStartTimeAsc(Long studioId);

    List<RecurringPatternEntity> findByStudioIdAndActiveTrueOrderByDayOfWeekAscStartTimeAsc(Long studioId);

    List<RecurringPatternEntity> findByTeacherIdOrderByDayOfWeekAscStartTimeAsc(Long teacherId);

    List<RecurringPatternEntity> findByTeacherIdAndActiveTrueOrderByDayOfWeekAscStartTimeAsc(Long teacherId);

    /**
     * 활성 패턴이 있는 학원 ID
     */
    @Query("SELECT DISTINCT p.studioId FROM RecurringPatternEntity p WHERE p.active = true ORDER BY p.studioId")
    List<Long> findStudioIdsWithActivePatterns();
}
