package personal.studio.schedule.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.studio.schedule.scheduling.application.port.in.CheckConflictCommand;
import personal.studio.schedule.scheduling.application.port.in.CheckConflictUseCase;
import personal.studio.schedule.scheduling.application.port.out.LessonOccurrenceRepository;
import personal.studio.schedule.scheduling.domain.model.ConflictDescriptor;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.service.ConflictDetector;

import java.util.List;

/**
 * Conflict Check Service
 * 수업 등록/변경 전 사전 충돌 확인 (읽기 전용)
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ConflictCheckService implements CheckConflictUseCase {

    private final LessonOccurrenceRepository lessonRepository;
    private final ConflictDetector conflictDetector;

    @Override
    public List<ConflictDescriptor> checkConflicts(CheckConflictCommand command) {
        LessonOccurrence candidate = LessonOccurrence.oneOff(command.studioId(), command.teacherId(),
                command.roomId(), command.lessonDate(), command.startTime(), command.durationMinutes(),
                null, command.studentIds());

        List<LessonOccurrence> sameDay = lessonRepository.findActiveInRange(command.studioId(),
                        command.teacherId(), command.roomId(), command.studentIds(),
                        command.lessonDate(), command.lessonDate()).stream()
                .filter(lesson -> !lesson.id().equals(command.excludeLessonId()))
                .toList();

        List<ConflictDescriptor> conflicts = List.copyOf(conflictDetector.findConflicts(candidate, sameDay));
        log.debug("Conflict check: studioId={}, date={}, start={}, excludeLessonId={}, conflicts={}",
                command.studioId(), command.lessonDate(), command.startTime(), command.excludeLessonId(),
                conflicts.size());
        return conflicts;
    }
}
