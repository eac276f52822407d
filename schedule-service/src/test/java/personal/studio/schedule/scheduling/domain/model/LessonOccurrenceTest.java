package personal.studio.schedule.scheduling.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.studio.common.exception.BusinessException;
import personal.studio.schedule.scheduling.domain.exception.AttendanceNotFoundException;
import personal.studio.schedule.scheduling.domain.exception.InvalidLessonStatusException;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LessonOccurrence 도메인 모델 테스트")
class LessonOccurrenceTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 1, 8);

    private LessonOccurrence generatedLesson() {
        RecurringPattern pattern = new RecurringPattern(1L, 1L, 7L, 3L, 1, LocalTime.of(10, 0), 60,
                LocalDate.of(2024, 1, 1), null, true, null, 0L);
        return LessonOccurrence.fromPattern(pattern,
                new LessonSlot(MONDAY, LocalTime.of(10, 0), LocalTime.of(11, 0)), Set.of(100L, 101L));
    }

    @Test
    @DisplayName("패턴으로 만든 수업은 원래 날짜와 학생 출석(SCHEDULED)을 가진다")
    void fromPattern() {
        // when
        LessonOccurrence lesson = generatedLesson();

        // then
        assertThat(lesson.patternId()).isEqualTo(1L);
        assertThat(lesson.originalDate()).isEqualTo(MONDAY);
        assertThat(lesson.status()).isEqualTo(LessonStatus.SCHEDULED);
        assertThat(lesson.exception()).isFalse();
        assertThat(lesson.attendance())
                .extracting(AttendanceRecord::status)
                .containsOnly(AttendanceStatus.SCHEDULED);
        assertThat(lesson.studentIds()).containsExactlyInAnyOrder(100L, 101L);
        assertThat(lesson.followsPattern()).isTrue();
    }

    @Test
    @DisplayName("단건 수업은 종료 시각이 자정을 넘으면 생성할 수 없다")
    void oneOff_pastMidnight() {
        assertThatThrownBy(() -> LessonOccurrence.oneOff(1L, 7L, null, MONDAY, LocalTime.of(23, 30), 60,
                null, Set.of()))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    @DisplayName("개별 일정 변경 시 패턴 수업은 예외 플래그가 붙고 원래 날짜는 유지된다")
    void reschedule_marksException() {
        // given
        LessonOccurrence lesson = generatedLesson();

        // when
        LessonOccurrence moved = lesson.reschedule(MONDAY.plusDays(1), LocalTime.of(11, 0), LocalTime.of(12, 0), 5L);

        // then
        assertThat(moved.exception()).isTrue();
        assertThat(moved.lessonDate()).isEqualTo(MONDAY.plusDays(1));
        assertThat(moved.originalDate()).isEqualTo(MONDAY);
        assertThat(moved.roomId()).isEqualTo(5L);
        assertThat(moved.followsPattern()).isFalse();
    }

    @Test
    @DisplayName("예정 상태가 아닌 수업은 일정 변경 불가")
    void reschedule_notScheduled() {
        LessonOccurrence completed = generatedLesson().changeStatus(LessonStatus.COMPLETED, null);

        assertThatThrownBy(() -> completed.reschedule(MONDAY, LocalTime.of(11, 0), LocalTime.of(12, 0), 3L))
                .isInstanceOf(InvalidLessonStatusException.class);
    }

    @Test
    @DisplayName("취소하면 예정된 출석도 취소되고, 복구하면 다시 예정으로 돌아온다")
    void cancelAndRestore() {
        // given
        LessonOccurrence lesson = generatedLesson();

        // when
        LessonOccurrence cancelled = lesson.changeStatus(LessonStatus.CANCELLED, "teacher sick");
        LessonOccurrence restored = cancelled.changeStatus(LessonStatus.SCHEDULED, null);

        // then
        assertThat(cancelled.cancellationReason()).isEqualTo("teacher sick");
        assertThat(cancelled.occupiesResources()).isFalse();
        assertThat(cancelled.attendance()).extracting(AttendanceRecord::status)
                .containsOnly(AttendanceStatus.CANCELLED);
        assertThat(restored.status()).isEqualTo(LessonStatus.SCHEDULED);
        assertThat(restored.cancellationReason()).isNull();
        assertThat(restored.attendance()).extracting(AttendanceRecord::status)
                .containsOnly(AttendanceStatus.SCHEDULED);
    }

    @Test
    @DisplayName("이미 취소된 수업을 다시 취소하면 변화 없음")
    void cancelTwice_noop() {
        LessonOccurrence cancelled = generatedLesson().changeStatus(LessonStatus.CANCELLED, "first");

        assertThat(cancelled.changeStatus(LessonStatus.CANCELLED, "second")).isSameAs(cancelled);
    }

    @Test
    @DisplayName("허용되지 않는 상태 전이는 InvalidLessonStatusException")
    void illegalTransitions() {
        LessonOccurrence missed = generatedLesson().changeStatus(LessonStatus.MISSED, null);
        LessonOccurrence completed = generatedLesson().changeStatus(LessonStatus.COMPLETED, null);

        assertThatThrownBy(() -> missed.changeStatus(LessonStatus.SCHEDULED, null))
                .isInstanceOf(InvalidLessonStatusException.class);
        assertThatThrownBy(() -> completed.changeStatus(LessonStatus.CANCELLED, null))
                .isInstanceOf(InvalidLessonStatusException.class);
        assertThat(completed.changeStatus(LessonStatus.MISSED, null).status()).isEqualTo(LessonStatus.MISSED);
    }

    @Test
    @DisplayName("새 템플릿으로 이동 시 남는 학생의 출석 상태는 유지되고 새 학생은 SCHEDULED")
    void followTemplate_keepsAttendance() {
        // given
        LessonOccurrence lesson = generatedLesson().markAttendance(100L, AttendanceStatus.ATTENDED);

        // when
        LessonOccurrence moved = lesson.followTemplate(5L, LocalTime.of(14, 0), LocalTime.of(15, 0),
                Set.of(100L, 102L));

        // then
        assertThat(moved.roomId()).isEqualTo(5L);
        assertThat(moved.startTime()).isEqualTo(LocalTime.of(14, 0));
        assertThat(moved.exception()).isFalse();
        assertThat(moved.attendance()).containsExactly(
                new AttendanceRecord(100L, AttendanceStatus.ATTENDED),
                new AttendanceRecord(102L, AttendanceStatus.SCHEDULED));
    }

    @Test
    @DisplayName("수업에 없는 학생의 출석 체크는 AttendanceNotFoundException")
    void markAttendance_unknownStudent() {
        assertThatThrownBy(() -> generatedLesson().markAttendance(999L, AttendanceStatus.ATTENDED))
                .isInstanceOf(AttendanceNotFoundException.class);
    }

    @Test
    @DisplayName("같은 학생이 두 번 등록될 수 없다")
    void duplicateStudents() {
        assertThatThrownBy(() -> new LessonOccurrence(null, 1L, 7L, 3L, null, MONDAY, LocalTime.of(10, 0),
                LocalTime.of(11, 0), null, LessonStatus.SCHEDULED, false, null, null,
                List.of(AttendanceRecord.scheduled(100L), AttendanceRecord.scheduled(100L)), null))
                .isInstanceOf(BusinessException.class);
    }
}
