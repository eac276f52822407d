package personal.studio.schedule.scheduling.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * Spring Data JPA Repository for PatternStudent
 */
public interface JpaPatternStudentRepository extends JpaRepository<PatternStudentEntity, Long> {

    List<PatternStudentEntity> findByPatternId(Long patternId);
}
