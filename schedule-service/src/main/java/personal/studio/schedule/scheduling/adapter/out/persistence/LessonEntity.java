package personal.studio.schedule.scheduling.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.studio.schedule.scheduling.domain.model.AttendanceRecord;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.model.LessonStatus;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Lesson JPA Entity
 * 수업 테이블 매핑
 * (recurring_pattern_id, original_date) 유니크 제약으로 같은 패턴 시간대의 중복 생성을 막는다.
 */
@Entity
@Table(name = "lessons",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_lesson_pattern_original_date",
                columnNames = {"recurring_pattern_id", "original_date"}
        ),
        indexes = {
                @Index(name = "idx_lesson_studio_date", columnList = "studio_id, lesson_date"),
                @Index(name = "idx_lesson_teacher_date", columnList = "teacher_id, lesson_date"),
                @Index(name = "idx_lesson_room_date", columnList = "room_id, lesson_date"),
                @Index(name = "idx_lesson_pattern_date", columnList = "recurring_pattern_id, lesson_date")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LessonEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "studio_id", nullable = false)
    private Long studioId;

    @Column(name = "teacher_id", nullable = false)
    private Long teacherId;

    @Column(name = "room_id")
    private Long roomId;

    @Column(name = "recurring_pattern_id")
    private Long patternId;

    @Column(name = "lesson_date", nullable = false)
    private LocalDate lessonDate;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "end_time", nullable = false)
    private LocalTime endTime;

    @Column(name = "original_date")
    private LocalDate originalDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private LessonStatus status;

    @Column(name = "is_exception", nullable = false)
    private boolean exception;

    @Column(name = "cancellation_reason", columnDefinition = "TEXT")
    private String cancellationReason;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @OneToMany(mappedBy = "lesson", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("studentId ASC")
    private List<LessonStudentEntity> students = new ArrayList<>();

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 신규 수업 엔티티 생성
     */
    public static LessonEntity fromDomain(LessonOccurrence lesson) {
        LessonEntity entity = new LessonEntity();
        entity.id = lesson.id();
        entity.studioId = lesson.studioId();
        entity.patternId = lesson.patternId();
        entity.originalDate = lesson.originalDate();
        entity.apply(lesson);
        return entity;
    }

    /**
     * 변경 가능한 값 반영 (영속성 컨텍스트 내에서 사용)
     * 출석 정보는 학생 단위로 맞춘다: 유지되는 학생은 상태만 갱신, 빠진 학생은 삭제, 새 학생은 추가
     */
    public void apply(LessonOccurrence lesson) {
        this.teacherId = lesson.teacherId();
        this.roomId = lesson.roomId();
        this.lessonDate = lesson.lessonDate();
        this.startTime = lesson.startTime();
        this.endTime = lesson.endTime();
        this.status = lesson.status();
        this.exception = lesson.exception();
        this.cancellationReason = lesson.cancellationReason();
        this.notes = lesson.notes();

        Map<Long, AttendanceRecord> target = lesson.attendance().stream()
                .collect(Collectors.toMap(AttendanceRecord::studentId, Function.identity(),
                        (first, second) -> first, LinkedHashMap::new));
        students.removeIf(student -> !target.containsKey(student.getStudentId()));
        for (LessonStudentEntity student : students) {
            student.updateStatus(target.remove(student.getStudentId()).status());
        }
        target.values().forEach(record -> students.add(LessonStudentEntity.of(this, record)));
    }

    @PrePersist
    protected void onCreate() {
        LocalDateTime now = LocalDateTime.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public LessonOccurrence toDomain() {
        List<AttendanceRecord> attendance = students.stream()
                .map(LessonStudentEntity::toDomain)
                .toList();
        return new LessonOccurrence(id, studioId, teacherId, roomId, patternId, lessonDate, startTime, endTime,
                originalDate, status, exception, cancellationReason, notes, attendance, version);
    }
}
