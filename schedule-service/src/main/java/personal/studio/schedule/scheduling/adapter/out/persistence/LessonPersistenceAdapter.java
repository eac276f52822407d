package personal.studio.schedule.scheduling.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import personal.studio.schedule.scheduling.application.port.out.LessonOccurrenceRepository;
import personal.studio.schedule.scheduling.domain.exception.LessonNotFoundException;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.model.LessonStatus;

import java.time.LocalDate;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Lesson Persistence Adapter
 * JPA 를 사용한 수업 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LessonPersistenceAdapter implements LessonOccurrenceRepository {

    // JPQL IN/비교 조건에 넣을 "해당 없음" 값
    private static final Long NO_ID = -1L;

    private final JpaLessonRepository jpaLessonRepository;

    @Override
    public Optional<LessonOccurrence> findById(Long lessonId) {
        log.debug("Finding lesson by id: {}", lessonId);
        return jpaLessonRepository.findWithStudentsById(lessonId)
                .map(LessonEntity::toDomain);
    }

    @Override
    public LessonOccurrence save(LessonOccurrence lesson) {
        log.debug("Saving lesson: lessonId={}, date={}, status={}", lesson.id(), lesson.lessonDate(), lesson.status());
        return jpaLessonRepository.saveAndFlush(toEntity(lesson)).toDomain();
    }

    @Override
    public List<LessonOccurrence> saveAll(List<LessonOccurrence> lessons) {
        log.debug("Saving lessons: count={}", lessons.size());
        List<LessonEntity> entities = lessons.stream()
                .map(this::toEntity)
                .toList();
        return jpaLessonRepository.saveAllAndFlush(entities).stream()
                .map(LessonEntity::toDomain)
                .toList();
    }

    private LessonEntity toEntity(LessonOccurrence lesson) {
        if (lesson.id() == null) {
            return LessonEntity.fromDomain(lesson);
        }
        LessonEntity entity = jpaLessonRepository.findWithStudentsById(lesson.id())
                .orElseThrow(() -> new LessonNotFoundException(lesson.id()));
        if (!Objects.equals(entity.getVersion(), lesson.version())) {
            throw new ObjectOptimisticLockingFailureException(LessonEntity.class, lesson.id());
        }
        entity.apply(lesson);
        return entity;
    }

    @Override
    public void deleteById(Long lessonId) {
        log.debug("Deleting lesson: lessonId={}", lessonId);
        jpaLessonRepository.findWithStudentsById(lessonId)
                .ifPresent(jpaLessonRepository::delete);
    }

    @Override
    public void deleteAllById(Collection<Long> lessonIds) {
        log.debug("Deleting lessons: count={}", lessonIds.size());
        jpaLessonRepository.deleteAll(jpaLessonRepository.findAllById(lessonIds));
    }

    @Override
    public int deleteByPatternId(Long patternId) {
        List<LessonEntity> lessons = jpaLessonRepository.findByPatternId(patternId);
        jpaLessonRepository.deleteAll(lessons);
        log.debug("Deleted lessons of pattern: patternId={}, count={}", patternId, lessons.size());
        return lessons.size();
    }

    @Override
    public List<LessonOccurrence> findActiveInRange(Long studioId, Long teacherId, Long roomId, Set<Long> studentIds,
                                                    LocalDate from, LocalDate to) {
        log.debug("Finding occupying lessons: studioId={}, teacherId={}, roomId={}, students={}, range={}..{}",
                studioId, teacherId, roomId, studentIds, from, to);
        return toDomain(jpaLessonRepository.findOccupyingInRange(
                studioId,
                teacherId,
                roomId != null ? roomId : NO_ID,
                studentIds == null || studentIds.isEmpty() ? List.of(NO_ID) : studentIds,
                from,
                to,
                LessonStatus.CANCELLED));
    }

    @Override
    public List<LessonOccurrence> findByPatternFrom(Long patternId, LocalDate from) {
        return toDomain(jpaLessonRepository.findByPatternFrom(patternId, from));
    }

    @Override
    public Set<LocalDate> findMaterializedDates(Long patternId, LocalDate from, LocalDate to) {
        return new HashSet<>(jpaLessonRepository.findOriginalDates(patternId, from, to));
    }

    @Override
    public long countByPattern(Long patternId) {
        return jpaLessonRepository.countByPatternId(patternId);
    }

    @Override
    public List<LessonOccurrence> findByStudio(Long studioId, LocalDate from, LocalDate to) {
        log.debug("Finding studio lessons: studioId={}, range={}..{}", studioId, from, to);
        return toDomain(jpaLessonRepository.findByStudioInRange(studioId, from, to));
    }

    @Override
    public List<LessonOccurrence> findByTeacher(Long teacherId, LocalDate from, LocalDate to) {
        log.debug("Finding teacher lessons: teacherId={}, range={}..{}", teacherId, from, to);
        return toDomain(jpaLessonRepository.findByTeacherInRange(teacherId, from, to));
    }

    @Override
    public List<LessonOccurrence> findByStudent(Long studentId, LocalDate from, LocalDate to) {
        log.debug("Finding student lessons: studentId={}, range={}..{}", studentId, from, to);
        return toDomain(jpaLessonRepository.findByStudentInRange(studentId, from, to));
    }

    private List<LessonOccurrence> toDomain(List<LessonEntity> entities) {
        return entities.stream()
                .map(LessonEntity::toDomain)
                .toList();
    }
}
