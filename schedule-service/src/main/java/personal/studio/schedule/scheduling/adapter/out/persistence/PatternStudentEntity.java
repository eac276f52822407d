package personal.studio.schedule.scheduling.adapter.out.persistence;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Pattern Student JPA Entity
 * 패턴에 등록된 학생 (생성되는 수업의 출석 대상)
 */
@Entity
@Table(name = "recurring_pattern_students",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_pattern_student",
                columnNames = {"recurring_pattern_id", "student_id"}
        ))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PatternStudentEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "recurring_pattern_id", nullable = false)
    private Long patternId;

    @Column(name = "student_id", nullable = false)
    private Long studentId;

    public static PatternStudentEntity of(Long patternId, Long studentId) {
        PatternStudentEntity entity = new PatternStudentEntity();
        entity.patternId = patternId;
        entity.studentId = studentId;
        return entity;
    }
}
