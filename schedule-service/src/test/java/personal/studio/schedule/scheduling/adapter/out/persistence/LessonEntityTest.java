package personal.studio.schedule.scheduling.adapter.out.persistence;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import personal.studio.schedule.scheduling.domain.model.AttendanceRecord;
import personal.studio.schedule.scheduling.domain.model.AttendanceStatus;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.model.LessonStatus;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("LessonEntity 매핑 테스트")
class LessonEntityTest {

    private static final LocalDate MONDAY = LocalDate.of(2024, 1, 8);

    private LessonOccurrence lesson(List<AttendanceRecord> attendance) {
        return new LessonOccurrence(null, 1L, 7L, 3L, 1L, MONDAY, LocalTime.of(10, 0), LocalTime.of(11, 0),
                MONDAY, LessonStatus.SCHEDULED, false, null, "bring sheet music", attendance, null);
    }

    @Test
    @DisplayName("도메인 -> 엔티티 -> 도메인 변환 시 값이 유지된다")
    void fromDomain_toDomain() {
        // given
        LessonOccurrence lesson = lesson(List.of(AttendanceRecord.scheduled(100L), AttendanceRecord.scheduled(101L)));

        // when
        LessonOccurrence restored = LessonEntity.fromDomain(lesson).toDomain();

        // then
        assertThat(restored).isEqualTo(lesson);
    }

    @Test
    @DisplayName("apply 는 남는 학생의 상태만 바꾸고, 빠진 학생은 제거하고, 새 학생은 추가한다")
    void apply_syncsStudents() {
        // given
        LessonEntity entity = LessonEntity.fromDomain(
                lesson(List.of(AttendanceRecord.scheduled(100L), AttendanceRecord.scheduled(101L))));
        LessonOccurrence changed = lesson(List.of(
                new AttendanceRecord(101L, AttendanceStatus.ATTENDED),
                AttendanceRecord.scheduled(102L)))
                .reschedule(MONDAY.plusDays(1), LocalTime.of(15, 0), LocalTime.of(16, 0), null);

        // when
        entity.apply(changed);

        // then
        LessonOccurrence result = entity.toDomain();
        assertThat(result.attendance()).containsExactly(
                new AttendanceRecord(101L, AttendanceStatus.ATTENDED),
                new AttendanceRecord(102L, AttendanceStatus.SCHEDULED));
        assertThat(result.lessonDate()).isEqualTo(MONDAY.plusDays(1));
        assertThat(result.originalDate()).isEqualTo(MONDAY);
        assertThat(result.roomId()).isNull();
        assertThat(result.exception()).isTrue();
        assertThat(entity.getStudents()).allSatisfy(student -> assertThat(student.getLesson()).isSameAs(entity));
    }
}
