package personal.studio.schedule.scheduling.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.studio.schedule.scheduling.domain.model.AttendanceRecord;
import personal.studio.schedule.scheduling.domain.model.AttendanceStatus;

/**
 * Lesson Student JPA Entity
 * 수업별 학생 출석 (LessonEntity 가 소유)
 */
@Entity
@Table(name = "lesson_students",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_lesson_student",
                columnNames = {"lesson_id", "student_id"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LessonStudentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "lesson_id", nullable = false)
    private LessonEntity lesson;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "attendance_status", nullable = false, length = 20)
    private AttendanceStatus attendanceStatus;

    static LessonStudentEntity of(LessonEntity lesson, AttendanceRecord record) {
        LessonStudentEntity entity = new LessonStudentEntity();
        entity.lesson = lesson;
        entity.studentId = record.studentId();
        entity.attendanceStatus = record.status();
        return entity;
    }

    void updateStatus(AttendanceStatus status) {
        this.attendanceStatus = status;
    }

    public AttendanceRecord toDomain() {
        return new AttendanceRecord(studentId, attendanceStatus);
    }
}
