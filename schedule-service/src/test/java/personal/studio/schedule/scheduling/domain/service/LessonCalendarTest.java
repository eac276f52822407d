package personal.studio.schedule.scheduling.domain.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.studio.schedule.scheduling.domain.exception.InvalidDateRangeException;
import personal.studio.schedule.scheduling.domain.model.LessonSlot;
import personal.studio.schedule.scheduling.domain.model.RecurringPattern;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("LessonCalendar 단위 테스트")
class LessonCalendarTest {

    private final LessonCalendar lessonCalendar = new LessonCalendar();

    private RecurringPattern mondayPattern(LocalDate validFrom, LocalDate validUntil) {
        return new RecurringPattern(1L, 1L, 7L, 3L, 1, LocalTime.of(10, 0), 60,
                validFrom, validUntil, true, null, 0L);
    }

    @Test
    @DisplayName("범위 안의 월요일마다 수업 슬롯을 만든다")
    void occurrences_weekly() {
        // given
        RecurringPattern pattern = mondayPattern(LocalDate.of(2024, 1, 1), null);

        // when
        List<LessonSlot> slots = lessonCalendar
                .occurrencesFor(pattern, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 28))
                .toList();

        // then
        assertThat(slots).extracting(LessonSlot::date).containsExactly(
                LocalDate.of(2024, 1, 1),
                LocalDate.of(2024, 1, 8),
                LocalDate.of(2024, 1, 15),
                LocalDate.of(2024, 1, 22));
        assertThat(slots).allSatisfy(slot -> {
            assertThat(slot.startTime()).isEqualTo(LocalTime.of(10, 0));
            assertThat(slot.endTime()).isEqualTo(LocalTime.of(11, 0));
        });
    }

    @Test
    @DisplayName("시작일이 요일 중간이면 다음 해당 요일부터 시작한다")
    void occurrences_startMidWeek() {
        // given - 2024-01-03 은 수요일
        RecurringPattern pattern = mondayPattern(LocalDate.of(2024, 1, 3), null);

        // when
        List<LessonSlot> slots = lessonCalendar
                .occurrencesFor(pattern, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 15))
                .toList();

        // then
        assertThat(slots).extracting(LessonSlot::date)
                .containsExactly(LocalDate.of(2024, 1, 8), LocalDate.of(2024, 1, 15));
    }

    @Test
    @DisplayName("패턴 종료일 이후는 만들지 않는다")
    void occurrences_respectsValidUntil() {
        RecurringPattern pattern = mondayPattern(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 10));

        List<LessonSlot> slots = lessonCalendar
                .occurrencesFor(pattern, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 1))
                .toList();

        assertThat(slots).extracting(LessonSlot::date)
                .containsExactly(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 8));
    }

    @Test
    @DisplayName("유효 기간과 범위가 겹치지 않으면 빈 결과")
    void occurrences_noOverlap() {
        RecurringPattern pattern = mondayPattern(LocalDate.of(2024, 6, 1), null);

        assertThat(lessonCalendar.occurrencesFor(pattern, LocalDate.of(2024, 1, 1), LocalDate.of(2024, 2, 1)))
                .isEmpty();
    }

    @Test
    @DisplayName("범위 끝이 시작보다 앞서면 InvalidDateRangeException")
    void occurrences_invalidRange() {
        RecurringPattern pattern = mondayPattern(LocalDate.of(2024, 1, 1), null);

        assertThatThrownBy(() -> lessonCalendar.occurrencesFor(pattern,
                LocalDate.of(2024, 2, 1), LocalDate.of(2024, 1, 1)))
                .isInstanceOf(InvalidDateRangeException.class);
    }
}
