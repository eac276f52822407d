package personal.studio.schedule.scheduling.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import personal.studio.schedule.scheduling.application.port.out.RecurringPatternRepository;
import personal.studio.schedule.scheduling.domain.exception.PatternNotFoundException;
import personal.studio.schedule.scheduling.domain.model.RecurringPattern;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recurring Pattern Persistence Adapter
 * JPA 를 사용한 반복 패턴 + 패턴 학생 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecurringPatternPersistenceAdapter implements RecurringPatternRepository {

    private final JpaRecurringPatternRepository jpaPatternRepository;
    private final JpaPatternStudentRepository jpaPatternStudentRepository;

    @Override
    public Optional<RecurringPattern> findById(Long patternId) {
        log.debug("Finding recurring pattern by id: {}", patternId);
        return jpaPatternRepository.findById(patternId)
                .map(RecurringPatternEntity::toDomain);
    }

    @Override
    public boolean existsById(Long patternId) {
        return jpaPatternRepository.existsById(patternId);
    }

    @Override
    public RecurringPattern save(RecurringPattern pattern) {
        log.debug("Saving recurring pattern: patternId={}, version={}", pattern.id(), pattern.version());
        RecurringPatternEntity entity = pattern.id() == null
                ? RecurringPatternEntity.fromDomain(pattern)
                : loadForUpdate(pattern);
        return jpaPatternRepository.saveAndFlush(entity).toDomain();
    }

    /**
     * 영속 엔티티에 변경 반영
     * 도메인 버전과 저장된 버전이 다르면 다른 트랜잭션이 먼저 수정한 것
     */
    private RecurringPatternEntity loadForUpdate(RecurringPattern pattern) {
        RecurringPatternEntity entity = jpaPatternRepository.findById(pattern.id())
                .orElseThrow(() -> new PatternNotFoundException(pattern.id()));
        if (!Objects.equals(entity.getVersion(), pattern.version())) {
            throw new ObjectOptimisticLockingFailureException(RecurringPatternEntity.class, pattern.id());
        }
        entity.apply(pattern);
        return entity;
    }

    @Override
    public void delete(Long patternId) {
        log.debug("Deleting recurring pattern and student links: patternId={}", patternId);
        jpaPatternStudentRepository.deleteAll(jpaPatternStudentRepository.findByPatternId(patternId));
        jpaPatternRepository.deleteById(patternId);
    }

    @Override
    public List<RecurringPattern> findActive() {
        return toDomain(jpaPatternRepository.findByActiveTrueOrderByIdAsc());
    }

    @Override
    public List<RecurringPattern> findActiveByStudio(Long studioId) {
        return findByStudio(studioId, true);
    }

    @Override
    public List<RecurringPattern> findByStudio(Long studioId, boolean activeOnly) {
        log.debug("Finding recurring patterns for studio: studioId={}, activeOnly={}", studioId, activeOnly);
        return toDomain(activeOnly
                ? jpaPatternRepository.findByStudioIdAndActiveTrueOrderByDayOfWeekAscStartTimeAsc(studioId)
                : jpaPatternRepository.findByStudioIdOrderByDayOfWeekAscStartTimeAsc(studioId));
    }

    @Override
    public List<RecurringPattern> findByTeacher(Long teacherId, boolean activeOnly) {
        log.debug("Finding recurring patterns for teacher: teacherId={}, activeOnly={}", teacherId, activeOnly);
        return toDomain(activeOnly
                ? jpaPatternRepository.findByTeacherIdAndActiveTrueOrderByDayOfWeekAscStartTimeAsc(teacherId)
                : jpaPatternRepository.findByTeacherIdOrderByDayOfWeekAscStartTimeAsc(teacherId));
    }

    @Override
    public List<Long> findStudioIdsWithActivePatterns() {
        return jpaPatternRepository.findStudioIdsWithActivePatterns();
    }

    @Override
    public Set<Long> findStudentIds(Long patternId) {
        return jpaPatternStudentRepository.findByPatternId(patternId).stream()
                .map(PatternStudentEntity::getStudentId)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * 기존 링크와 비교하여 빠진 학생은 삭제, 새 학생만 추가
     */
    @Override
    public void replaceStudentLinks(Long patternId, Set<Long> studentIds) {
        List<PatternStudentEntity> current = jpaPatternStudentRepository.findByPatternId(patternId);

        List<PatternStudentEntity> removed = current.stream()
                .filter(link -> !studentIds.contains(link.getStudentId()))
                .toList();
        Set<Long> existing = current.stream()
                .map(PatternStudentEntity::getStudentId)
                .collect(Collectors.toSet());
        List<PatternStudentEntity> added = studentIds.stream()
                .filter(studentId -> !existing.contains(studentId))
                .map(studentId -> PatternStudentEntity.of(patternId, studentId))
                .toList();

        jpaPatternStudentRepository.deleteAll(removed);
        jpaPatternStudentRepository.saveAll(added);
        log.debug("Pattern students replaced: patternId={}, added={}, removed={}",
                patternId, added.size(), removed.size());
    }

    private List<RecurringPattern> toDomain(List<RecurringPatternEntity> entities) {
        return entities.stream()
                .map(RecurringPatternEntity::toDomain)
                .toList();
    }
}
