package personal.studio.schedule.scheduling.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import personal.studio.schedule.scheduling.domain.model.RecurringPattern;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;

/**
 * Recurring Pattern JPA Entity
 * 반복 패턴 테이블 매핑 (학생/수업은 patternId 로만 참조)
 */
@Entity
@Table(name = "recurring_patterns",
        indexes = {
                @Index(name = "idx_pattern_studio_active", columnList = "studio_id, is_active"),
                @Index(name = "idx_pattern_teacher", columnList = "teacher_id")
        })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class RecurringPatternEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "studio_id", nullable = false)
    private Long studioId;

    @Column(name = "teacher_id", nullable = false)
    private Long teacherId;

    @Column(name = "room_id")
    private Long roomId;

    @Column(name = "day_of_week", nullable = false)
    private int dayOfWeek;

    @Column(name = "start_time", nullable = false)
    private LocalTime startTime;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(name = "valid_from", nullable = false)
    private LocalDate validFrom;

    @Column(name = "valid_until")
    private LocalDate validUntil;

    @Column(name = "is_active", nullable = false)
    private boolean active;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Version
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 신규 패턴 엔티티 생성
     */
    public static RecurringPatternEntity fromDomain(RecurringPattern pattern) {
        RecurringPatternEntity entity = new RecurringPatternEntity();
        entity.id = pattern.id();
        entity.studioId = pattern.studioId();
        entity.teacherId = pattern.teacherId();
        entity.dayOfWeek = pattern.dayOfWeek();
        entity.validFrom = pattern.validFrom();
        entity.apply(pattern);
        return entity;
    }

    /**
     * 변경 가능한 값 반영 (영속성 컨텍스트 내에서 사용)
     * 요일과 시작일은 변경하지 않는다.
     */
    public void apply(RecurringPattern pattern) {
        this.roomId = pattern.roomId();
        this.startTime = pattern.startTime();
        this.durationMinutes = pattern.durationMinutes();
        this.validUntil = pattern.validUntil();
        this.active = pattern.active();
        this.notes = pattern.notes();
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

    public RecurringPattern toDomain() {
        return new RecurringPattern(id, studioId, teacherId, roomId, dayOfWeek, startTime, durationMinutes,
                validFrom, validUntil, active, notes, version);
    }
}
