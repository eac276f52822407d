package personal.studio.schedule.scheduling.adapter.out.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import personal.studio.schedule.scheduling.domain.model.AttendanceRecord;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.model.LessonStatus;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("LessonPersistenceAdapter 단위 테스트")
class LessonPersistenceAdapterTest {

    private static final LocalDate FROM = LocalDate.of(2024, 1, 1);
    private static final LocalDate TO = LocalDate.of(2024, 1, 31);

    @Mock
    private JpaLessonRepository jpaLessonRepository;
    @InjectMocks
    private LessonPersistenceAdapter lessonPersistenceAdapter;

    @Test
    @DisplayName("온라인 수업이거나 학생이 없으면 -1 을 넘겨 해당 조건이 매칭되지 않게 한다")
    void findActiveInRange_placeholders() {
        // given
        given(jpaLessonRepository.findOccupyingInRange(1L, 7L, -1L, List.of(-1L), FROM, TO, LessonStatus.CANCELLED))
                .willReturn(List.of());

        // when
        List<LessonOccurrence> result = lessonPersistenceAdapter.findActiveInRange(1L, 7L, null, Set.of(), FROM, TO);

        // then
        assertThat(result).isEmpty();
    }

    @Test
    @DisplayName("저장된 버전과 다른 버전으로 저장하면 ObjectOptimisticLockingFailureException")
    void save_staleVersion() {
        // given
        LessonOccurrence stored = new LessonOccurrence(null, 1L, 7L, 3L, 1L, FROM, LocalTime.of(10, 0),
                LocalTime.of(11, 0), FROM, LessonStatus.SCHEDULED, false, null, null,
                List.of(AttendanceRecord.scheduled(100L)), null);
        LessonEntity entity = LessonEntity.fromDomain(stored);
        LessonOccurrence stale = new LessonOccurrence(11L, 1L, 7L, 3L, 1L, FROM, LocalTime.of(10, 0),
                LocalTime.of(11, 0), FROM, LessonStatus.COMPLETED, false, null, null,
                List.of(AttendanceRecord.scheduled(100L)), 3L);
        given(jpaLessonRepository.findWithStudentsById(11L)).willReturn(Optional.of(entity));

        // when & then
        assertThatThrownBy(() -> lessonPersistenceAdapter.save(stale))
                .isInstanceOf(ObjectOptimisticLockingFailureException.class);
        verify(jpaLessonRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("패턴 삭제 시 생성된 수업 수를 반환한다")
    void deleteByPatternId() {
        // given
        LessonEntity lesson = LessonEntity.fromDomain(new LessonOccurrence(null, 1L, 7L, 3L, 1L, FROM,
                LocalTime.of(10, 0), LocalTime.of(11, 0), FROM, LessonStatus.SCHEDULED, false, null, null,
                List.of(), null));
        given(jpaLessonRepository.findByPatternId(1L)).willReturn(List.of(lesson, lesson));

        // when
        int deleted = lessonPersistenceAdapter.deleteByPatternId(1L);

        // then
        assertThat(deleted).isEqualTo(2);
        verify(jpaLessonRepository).deleteAll(List.of(lesson, lesson));
    }
}
