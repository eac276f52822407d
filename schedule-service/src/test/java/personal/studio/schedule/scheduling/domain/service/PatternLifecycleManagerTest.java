package personal.studio.schedule.scheduling.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.studio.schedule.scheduling.application.config.ScheduleProperties;
import personal.studio.schedule.scheduling.application.port.in.CreatePatternCommand;
import personal.studio.schedule.scheduling.application.port.in.UpdatePatternCommand;
import personal.studio.schedule.scheduling.application.port.out.LessonOccurrenceRepository;
import personal.studio.schedule.scheduling.application.port.out.RecurringPatternRepository;
import personal.studio.schedule.scheduling.domain.exception.ConcurrentScheduleModificationException;
import personal.studio.schedule.scheduling.domain.exception.InvalidPatternException;
import personal.studio.schedule.scheduling.domain.exception.PatternNotFoundException;
import personal.studio.schedule.scheduling.domain.exception.UpdateConflictException;
import personal.studio.schedule.scheduling.domain.model.AttendanceRecord;
import personal.studio.schedule.scheduling.domain.model.ForcePolicy;
import personal.studio.schedule.scheduling.domain.model.GenerationResult;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.model.LessonStatus;
import personal.studio.schedule.scheduling.domain.model.PatternCreationResult;
import personal.studio.schedule.scheduling.domain.model.PatternUpdateResult;
import personal.studio.schedule.scheduling.domain.model.RecurringPattern;
import personal.studio.schedule.scheduling.domain.model.ResourceType;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("PatternLifecycleManager 단위 테스트")
class PatternLifecycleManagerTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 1, 1);
    private static final Long PATTERN_ID = 1L;
    private static final Long STUDIO_ID = 1L;
    private static final Long TEACHER_ID = 7L;
    private static final Set<Long> STUDENTS = Set.of(100L);

    @Mock
    private RecurringPatternRepository patternRepository;
    @Mock
    private LessonOccurrenceRepository lessonRepository;
    @Mock
    private LessonGenerator lessonGenerator;

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T09:00:00Z"), ZoneOffset.UTC);
    private PatternLifecycleManager manager;
    private RecurringPattern current;

    @BeforeEach
    void setUp() {
        manager = managerWith(ForcePolicy.SKIP_CONFLICTS);
        current = new RecurringPattern(PATTERN_ID, STUDIO_ID, TEACHER_ID, 3L, 1, LocalTime.of(10, 0), 60,
                TODAY, null, true, null, 0L);
    }

    private PatternLifecycleManager managerWith(ForcePolicy forcePolicy) {
        ScheduleProperties properties = new ScheduleProperties(2, 52, "UTC", "0 0 2 * * *",
                forcePolicy, new ScheduleProperties.ExceptionPolicy(false));
        return new PatternLifecycleManager(patternRepository, lessonRepository, lessonGenerator,
                new ConflictDetector(), properties, clock);
    }

    private LessonOccurrence generated(Long id, LocalDate date) {
        return new LessonOccurrence(id, STUDIO_ID, TEACHER_ID, 3L, PATTERN_ID, date, LocalTime.of(10, 0),
                LocalTime.of(11, 0), date, LessonStatus.SCHEDULED, false, null, null,
                List.of(AttendanceRecord.scheduled(100L)), 0L);
    }

    private UpdatePatternCommand changeRoom(Long roomId, boolean force) {
        return new UpdatePatternCommand(PATTERN_ID, roomId, false, null, null, null, false,
                null, null, null, null, force);
    }

    private void givenCurrentPattern() {
        given(patternRepository.findById(PATTERN_ID)).willReturn(Optional.of(current));
        given(patternRepository.findStudentIds(PATTERN_ID)).willReturn(STUDENTS);
    }

    private void givenSaveReturnsArgument() {
        willAnswer(invocation -> invocation.getArgument(0)).given(patternRepository).save(any(RecurringPattern.class));
    }

    @Nested
    @DisplayName("패턴 등록")
    class Create {

        @Test
        @DisplayName("저장 후 학생을 연결하고 기본 범위까지 수업을 생성한다")
        void create_success() {
            // given
            CreatePatternCommand command = new CreatePatternCommand(STUDIO_ID, TEACHER_ID, 3L, 1,
                    LocalTime.of(10, 0), 60, TODAY, null, null, STUDENTS);
            GenerationResult generation = new GenerationResult(
                    List.of(generated(11L, TODAY), generated(12L, TODAY.plusWeeks(1))), List.of());
            given(patternRepository.save(any(RecurringPattern.class))).willReturn(current);
            given(lessonGenerator.generateUpToDefaultHorizon(current)).willReturn(generation);

            // when
            PatternCreationResult result = manager.create(command);

            // then
            assertThat(result.pattern()).isEqualTo(current);
            assertThat(result.studentIds()).isEqualTo(STUDENTS);
            assertThat(result.generation().createdCount()).isEqualTo(2);
            verify(patternRepository).replaceStudentLinks(PATTERN_ID, STUDENTS);
        }

        @Test
        @DisplayName("잘못된 수업 길이는 저장 전에 거부된다")
        void create_invalidDuration() {
            CreatePatternCommand command = new CreatePatternCommand(STUDIO_ID, TEACHER_ID, 3L, 1,
                    LocalTime.of(10, 0), 20, TODAY, null, null, STUDENTS);

            assertThatThrownBy(() -> manager.create(command))
                    .isInstanceOf(InvalidPatternException.class);
            verifyNoInteractions(patternRepository, lessonGenerator);
        }
    }

    @Nested
    @DisplayName("강의실/시간 변경")
    class Reschedule {

        @Test
        @DisplayName("충돌이 없으면 오늘 이후 예정 수업이 모두 새 강의실로 이동한다")
        @SuppressWarnings("unchecked")
        void changeRoom_success() {
            // given
            givenCurrentPattern();
            givenSaveReturnsArgument();
            LessonOccurrence first = generated(11L, LocalDate.of(2024, 1, 8));
            LessonOccurrence second = generated(12L, LocalDate.of(2024, 1, 15));
            given(lessonRepository.findByPatternFrom(PATTERN_ID, TODAY)).willReturn(List.of(first, second));
            given(lessonRepository.findActiveInRange(STUDIO_ID, TEACHER_ID, 5L, STUDENTS,
                    first.lessonDate(), second.lessonDate())).willReturn(List.of(first, second));

            // when
            PatternUpdateResult result = manager.update(changeRoom(5L, false));

            // then
            assertThat(result.pattern().roomId()).isEqualTo(5L);
            assertThat(result.rescheduledLessons()).isEqualTo(2);
            assertThat(result.conflicts()).isEmpty();

            ArgumentCaptor<List<LessonOccurrence>> captor = ArgumentCaptor.forClass(List.class);
            verify(lessonRepository).saveAll(captor.capture());
            assertThat(captor.getValue()).extracting(LessonOccurrence::roomId).containsOnly(5L);
            verify(lessonGenerator, never()).generateUpToDefaultHorizon(any());
        }

        @Test
        @DisplayName("새 강의실이 한 날짜라도 사용 중이면 아무것도 바꾸지 않고 UpdateConflictException")
        void changeRoom_conflict() {
            // given
            givenCurrentPattern();
            LessonOccurrence first = generated(11L, LocalDate.of(2024, 1, 8));
            LessonOccurrence second = generated(12L, LocalDate.of(2024, 1, 15));
            given(lessonRepository.findByPatternFrom(PATTERN_ID, TODAY)).willReturn(List.of(first, second));
            given(lessonRepository.findActiveInRange(STUDIO_ID, TEACHER_ID, 5L, STUDENTS,
                    first.lessonDate(), second.lessonDate())).willReturn(List.of(first, second, roomFiveBusy()));

            // when & then
            assertThatThrownBy(() -> manager.update(changeRoom(5L, false)))
                    .isInstanceOfSatisfying(UpdateConflictException.class, e -> {
                        assertThat(e.getConflictDates()).containsExactly(LocalDate.of(2024, 1, 15));
                        assertThat(e.getConflicts()).extracting(c -> c.resourceType())
                                .containsExactly(ResourceType.ROOM);
                    });
            verify(lessonRepository, never()).saveAll(anyList());
            verify(patternRepository, never()).save(any());
        }

        @Test
        @DisplayName("force + SKIP_CONFLICTS 이면 충돌 수업은 그대로 두고 나머지만 이동한다")
        @SuppressWarnings("unchecked")
        void changeRoom_forceSkip() {
            // given
            givenCurrentPattern();
            givenSaveReturnsArgument();
            LessonOccurrence first = generated(11L, LocalDate.of(2024, 1, 8));
            LessonOccurrence second = generated(12L, LocalDate.of(2024, 1, 15));
            given(lessonRepository.findByPatternFrom(PATTERN_ID, TODAY)).willReturn(List.of(first, second));
            given(lessonRepository.findActiveInRange(STUDIO_ID, TEACHER_ID, 5L, STUDENTS,
                    first.lessonDate(), second.lessonDate())).willReturn(List.of(roomFiveBusy()));

            // when
            PatternUpdateResult result = manager.update(changeRoom(5L, true));

            // then
            assertThat(result.rescheduledLessons()).isEqualTo(1);
            assertThat(result.conflicts()).hasSize(1);
            ArgumentCaptor<List<LessonOccurrence>> captor = ArgumentCaptor.forClass(List.class);
            verify(lessonRepository).saveAll(captor.capture());
            assertThat(captor.getValue()).extracting(LessonOccurrence::id).containsExactly(11L);
        }

        @Test
        @DisplayName("force + OVERRIDE 이면 충돌이 있어도 모두 이동하고 충돌을 보고한다")
        @SuppressWarnings("unchecked")
        void changeRoom_forceOverride() {
            // given
            PatternLifecycleManager overriding = managerWith(ForcePolicy.OVERRIDE);
            givenCurrentPattern();
            givenSaveReturnsArgument();
            LessonOccurrence first = generated(11L, LocalDate.of(2024, 1, 8));
            LessonOccurrence second = generated(12L, LocalDate.of(2024, 1, 15));
            given(lessonRepository.findByPatternFrom(PATTERN_ID, TODAY)).willReturn(List.of(first, second));
            given(lessonRepository.findActiveInRange(STUDIO_ID, TEACHER_ID, 5L, STUDENTS,
                    first.lessonDate(), second.lessonDate())).willReturn(List.of(roomFiveBusy()));

            // when
            PatternUpdateResult result = overriding.update(changeRoom(5L, true));

            // then
            assertThat(result.rescheduledLessons()).isEqualTo(2);
            assertThat(result.conflicts()).hasSize(1);
            ArgumentCaptor<List<LessonOccurrence>> captor = ArgumentCaptor.forClass(List.class);
            verify(lessonRepository).saveAll(captor.capture());
            assertThat(captor.getValue()).extracting(LessonOccurrence::id).containsExactly(11L, 12L);
        }

        @Test
        @DisplayName("시간 변경 시 개별 변경된 수업은 건드리지 않는다")
        @SuppressWarnings("unchecked")
        void changeTime_leavesExceptionsAlone() {
            // given
            givenCurrentPattern();
            givenSaveReturnsArgument();
            LessonOccurrence regular = generated(11L, LocalDate.of(2024, 1, 8));
            LessonOccurrence movedByHand = generated(12L, LocalDate.of(2024, 1, 15))
                    .reschedule(LocalDate.of(2024, 1, 16), LocalTime.of(15, 0), LocalTime.of(16, 0), 3L);
            given(lessonRepository.findByPatternFrom(PATTERN_ID, TODAY)).willReturn(List.of(regular, movedByHand));
            given(lessonRepository.findActiveInRange(STUDIO_ID, TEACHER_ID, 3L, STUDENTS,
                    regular.lessonDate(), regular.lessonDate())).willReturn(List.of(regular));
            UpdatePatternCommand command = new UpdatePatternCommand(PATTERN_ID, null, false,
                    LocalTime.of(14, 0), null, null, false, null, null, null, null, false);

            // when
            PatternUpdateResult result = manager.update(command);

            // then
            assertThat(result.rescheduledLessons()).isEqualTo(1);
            ArgumentCaptor<List<LessonOccurrence>> captor = ArgumentCaptor.forClass(List.class);
            verify(lessonRepository).saveAll(captor.capture());
            assertThat(captor.getValue()).singleElement().satisfies(lesson -> {
                assertThat(lesson.id()).isEqualTo(11L);
                assertThat(lesson.startTime()).isEqualTo(LocalTime.of(14, 0));
                assertThat(lesson.endTime()).isEqualTo(LocalTime.of(15, 0));
            });
        }

        private LessonOccurrence roomFiveBusy() {
            return new LessonOccurrence(90L, STUDIO_ID, 8L, 5L, null, LocalDate.of(2024, 1, 15),
                    LocalTime.of(10, 0), LocalTime.of(11, 0), null, LessonStatus.SCHEDULED, false,
                    null, null, List.of(), 0L);
        }
    }

    @Nested
    @DisplayName("유효 기간/활성 상태 변경")
    class Validity {

        @Test
        @DisplayName("종료일을 앞당기면 그 이후의 예정 수업만 삭제된다 (개별 변경 수업은 유지)")
        void shortenValidity() {
            // given
            givenCurrentPattern();
            givenSaveReturnsArgument();
            LessonOccurrence beyond = generated(12L, LocalDate.of(2024, 1, 15));
            LessonOccurrence exception = generated(13L, LocalDate.of(2024, 1, 22)).asException();
            given(lessonRepository.findByPatternFrom(PATTERN_ID, LocalDate.of(2024, 1, 11)))
                    .willReturn(List.of(beyond, exception));
            UpdatePatternCommand command = new UpdatePatternCommand(PATTERN_ID, null, false, null, null,
                    LocalDate.of(2024, 1, 10), false, null, null, null, null, false);

            // when
            PatternUpdateResult result = manager.update(command);

            // then
            assertThat(result.deletedLessons()).isEqualTo(1);
            assertThat(result.pattern().validUntil()).isEqualTo(LocalDate.of(2024, 1, 10));
            verify(lessonRepository).deleteAllById(List.of(12L));
            verify(lessonGenerator, never()).generateUpToDefaultHorizon(any());
        }

        @Test
        @DisplayName("종료일을 늘리면 기본 범위까지 새 수업을 생성한다")
        void extendValidity() {
            // given
            current = current.withValidUntil(LocalDate.of(2024, 1, 8));
            givenCurrentPattern();
            givenSaveReturnsArgument();
            GenerationResult generation = new GenerationResult(
                    List.of(generated(13L, LocalDate.of(2024, 1, 15))), List.of());
            given(lessonGenerator.generateUpToDefaultHorizon(any(RecurringPattern.class))).willReturn(generation);
            UpdatePatternCommand command = new UpdatePatternCommand(PATTERN_ID, null, false, null, null,
                    LocalDate.of(2024, 2, 29), false, null, null, null, null, false);

            // when
            PatternUpdateResult result = manager.update(command);

            // then
            assertThat(result.generation().createdCount()).isEqualTo(1);
            verify(lessonRepository, never()).deleteAllById(any());
        }

        @Test
        @DisplayName("비활성화는 기존 수업을 건드리지 않고 새 생성도 하지 않는다")
        void deactivate() {
            // given
            givenCurrentPattern();
            givenSaveReturnsArgument();

            // when
            PatternUpdateResult result = manager.update(UpdatePatternCommand.deactivate(PATTERN_ID));

            // then
            assertThat(result.pattern().active()).isFalse();
            verifyNoInteractions(lessonRepository, lessonGenerator);
        }

        @Test
        @DisplayName("재활성화하면 수업 생성을 이어간다")
        void reactivate() {
            // given
            current = current.withActive(false);
            givenCurrentPattern();
            givenSaveReturnsArgument();
            given(lessonGenerator.generateUpToDefaultHorizon(any(RecurringPattern.class)))
                    .willReturn(GenerationResult.empty());
            UpdatePatternCommand command = new UpdatePatternCommand(PATTERN_ID, null, false, null, null,
                    null, false, true, null, null, null, false);

            // when
            PatternUpdateResult result = manager.update(command);

            // then
            assertThat(result.pattern().active()).isTrue();
            verify(lessonGenerator).generateUpToDefaultHorizon(result.pattern());
        }

        @Test
        @DisplayName("클라이언트 버전이 다르면 ConcurrentScheduleModificationException")
        void versionMismatch() {
            // given
            given(patternRepository.findById(PATTERN_ID)).willReturn(Optional.of(current));
            UpdatePatternCommand command = new UpdatePatternCommand(PATTERN_ID, 5L, false, null, null,
                    null, false, null, null, null, 5L, false);

            // when & then
            assertThatThrownBy(() -> manager.update(command))
                    .isInstanceOf(ConcurrentScheduleModificationException.class);
            verify(patternRepository, never()).save(any());
        }

        @Test
        @DisplayName("없는 패턴 변경 시 PatternNotFoundException")
        void update_notFound() {
            given(patternRepository.findById(PATTERN_ID)).willReturn(Optional.empty());

            assertThatThrownBy(() -> manager.update(UpdatePatternCommand.deactivate(PATTERN_ID)))
                    .isInstanceOf(PatternNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("패턴 삭제")
    class Delete {

        @Test
        @DisplayName("생성된 수업을 모두 지우고 패턴을 삭제한다")
        void delete_success() {
            // given
            given(patternRepository.existsById(PATTERN_ID)).willReturn(true);
            given(lessonRepository.deleteByPatternId(PATTERN_ID)).willReturn(3);

            // when
            int deleted = manager.delete(PATTERN_ID);

            // then
            assertThat(deleted).isEqualTo(3);
            verify(patternRepository).delete(PATTERN_ID);
        }

        @Test
        @DisplayName("없는 패턴 삭제 시 PatternNotFoundException")
        void delete_notFound() {
            given(patternRepository.existsById(PATTERN_ID)).willReturn(false);

            assertThatThrownBy(() -> manager.delete(PATTERN_ID))
                    .isInstanceOf(PatternNotFoundException.class);
            verifyNoInteractions(lessonRepository);
        }
    }
}
