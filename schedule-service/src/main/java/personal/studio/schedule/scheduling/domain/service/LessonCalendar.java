package personal.studio.schedule.scheduling.domain.service;

import org.springframework.stereotype.Component;
import personal.studio.schedule.scheduling.domain.exception.InvalidDateRangeException;
import personal.studio.schedule.scheduling.domain.model.LessonSlot;
import personal.studio.schedule.scheduling.domain.model.RecurringPattern;

import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;
import java.util.stream.Stream;

/**
 * Lesson Calendar
 * 반복 패턴이 주어진 기간 안에서 만들어내는 수업 날짜 계산 (상태 없음)
 */
@Component
public class LessonCalendar {

    /**
     * [horizonStart, horizonEnd] 와 패턴 유효 기간이 겹치는 구간에서
     * 패턴 요일에 해당하는 날짜를 한 주에 하나씩 반환한다.
     * 호출할 때마다 새 Stream 을 만든다.
     *
     * @throws InvalidDateRangeException horizonEnd 가 horizonStart 보다 앞설 때
     */
    public Stream<LessonSlot> occurrencesFor(RecurringPattern pattern, LocalDate horizonStart, LocalDate horizonEnd) {
        if (horizonEnd.isBefore(horizonStart)) {
            throw new InvalidDateRangeException(horizonStart, horizonEnd);
        }

        LocalDate from = later(horizonStart, pattern.validFrom());
        LocalDate until = pattern.isOpenEnded() ? horizonEnd : earlier(horizonEnd, pattern.validUntil());
        if (until.isBefore(from)) {
            return Stream.empty();
        }

        LocalDate first = from.with(TemporalAdjusters.nextOrSame(pattern.weekday()));
        return Stream.iterate(first, date -> !date.isAfter(until), date -> date.plusWeeks(1))
                .map(date -> new LessonSlot(date, pattern.startTime(), pattern.endTime()));
    }

    private static LocalDate later(LocalDate a, LocalDate b) {
        return a.isAfter(b) ? a : b;
    }

    private static LocalDate earlier(LocalDate a, LocalDate b) {
        return a.isBefore(b) ? a : b;
    }
}
