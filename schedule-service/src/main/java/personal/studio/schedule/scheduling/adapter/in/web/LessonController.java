package personal.studio.schedule.scheduling.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.studio.common.security.AccessPolicy;
import personal.studio.common.security.Role;
import personal.studio.schedule.scheduling.adapter.in.web.dto.ChangeLessonStatusRequest;
import personal.studio.schedule.scheduling.adapter.in.web.dto.CreateLessonRequest;
import personal.studio.schedule.scheduling.adapter.in.web.dto.GenerationResponse;
import personal.studio.schedule.scheduling.adapter.in.web.dto.LessonExceptionRequest;
import personal.studio.schedule.scheduling.adapter.in.web.dto.LessonResponse;
import personal.studio.schedule.scheduling.adapter.in.web.dto.MarkAttendanceRequest;
import personal.studio.schedule.scheduling.application.port.in.CreateLessonExceptionUseCase;
import personal.studio.schedule.scheduling.application.port.in.CreateLessonUseCase;
import personal.studio.schedule.scheduling.application.port.in.GetScheduleUseCase;
import personal.studio.schedule.scheduling.application.port.in.RevertLessonExceptionUseCase;
import personal.studio.schedule.scheduling.application.port.in.UpdateLessonUseCase;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;

/**
 * Lesson API Controller
 * 수업 단건 등록/조회/개별 변경/상태/출석/삭제 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/lessons")
@RequiredArgsConstructor
public class LessonController {

    private final CreateLessonUseCase createLessonUseCase;
    private final UpdateLessonUseCase updateLessonUseCase;
    private final CreateLessonExceptionUseCase createLessonExceptionUseCase;
    private final RevertLessonExceptionUseCase revertLessonExceptionUseCase;
    private final GetScheduleUseCase getScheduleUseCase;
    private final AccessPolicy accessPolicy;

    /**
     * 단건 수업 등록
     * POST /api/v1/lessons
     */
    @PostMapping
    public ResponseEntity<LessonResponse> createLesson(
            @Valid @RequestBody CreateLessonRequest request,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        log.info("Create lesson: userId={}, teacherId={}, date={}", userId, request.teacherId(), request.lessonDate());
        accessPolicy.ensureCanManage(userId, Role.from(role), request.teacherId());

        LessonOccurrence lesson = createLessonUseCase.createLesson(request.toCommand());
        return ResponseEntity.status(HttpStatus.CREATED).body(LessonResponse.from(lesson));
    }

    /**
     * GET /api/v1/lessons/{lessonId}
     */
    @GetMapping("/{lessonId}")
    public ResponseEntity<LessonResponse> getLesson(
            @PathVariable Long lessonId,
            @RequestHeader("X-User-Role") String role
    ) {
        accessPolicy.ensureCanView(Role.from(role));
        return ResponseEntity.ok(LessonResponse.from(getScheduleUseCase.getLesson(lessonId)));
    }

    /**
     * 수업 1건만 일정 변경/취소
     * POST /api/v1/lessons/{lessonId}/exception
     */
    @PostMapping("/{lessonId}/exception")
    public ResponseEntity<LessonResponse> createException(
            @PathVariable Long lessonId,
            @Valid @RequestBody LessonExceptionRequest request,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        log.info("Create lesson exception: userId={}, lessonId={}", userId, lessonId);
        ensureCanManageLesson(lessonId, userId, role);

        LessonOccurrence lesson = createLessonExceptionUseCase.createException(request.toCommand(lessonId));
        return ResponseEntity.ok(LessonResponse.from(lesson));
    }

    /**
     * 개별 변경 되돌리기
     * DELETE /api/v1/lessons/{lessonId}/exception
     */
    @DeleteMapping("/{lessonId}/exception")
    public ResponseEntity<GenerationResponse> revertException(
            @PathVariable Long lessonId,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        log.info("Revert lesson exception: userId={}, lessonId={}", userId, lessonId);
        ensureCanManageLesson(lessonId, userId, role);

        return ResponseEntity.ok(GenerationResponse.from(revertLessonExceptionUseCase.revertException(lessonId)));
    }

    /**
     * POST /api/v1/lessons/{lessonId}/status
     */
    @PostMapping("/{lessonId}/status")
    public ResponseEntity<LessonResponse> changeStatus(
            @PathVariable Long lessonId,
            @Valid @RequestBody ChangeLessonStatusRequest request,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        log.info("Change lesson status: userId={}, lessonId={}, status={}", userId, lessonId, request.status());
        ensureCanManageLesson(lessonId, userId, role);

        return ResponseEntity.ok(LessonResponse.from(updateLessonUseCase.changeStatus(request.toCommand(lessonId))));
    }

    /**
     * PUT /api/v1/lessons/{lessonId}/attendance/{studentId}
     */
    @PutMapping("/{lessonId}/attendance/{studentId}")
    public ResponseEntity<LessonResponse> markAttendance(
            @PathVariable Long lessonId,
            @PathVariable Long studentId,
            @Valid @RequestBody MarkAttendanceRequest request,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        log.info("Mark attendance: userId={}, lessonId={}, studentId={}, status={}",
                userId, lessonId, studentId, request.status());
        LessonOccurrence lesson = getScheduleUseCase.getLesson(lessonId);
        accessPolicy.ensureCanMarkAttendance(userId, Role.from(role), lesson.teacherId());

        return ResponseEntity.ok(LessonResponse.from(
                updateLessonUseCase.markAttendance(request.toCommand(lessonId, studentId))));
    }

    /**
     * DELETE /api/v1/lessons/{lessonId}
     */
    @DeleteMapping("/{lessonId}")
    public ResponseEntity<Void> deleteLesson(
            @PathVariable Long lessonId,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        log.info("Delete lesson: userId={}, lessonId={}", userId, lessonId);
        ensureCanManageLesson(lessonId, userId, role);

        updateLessonUseCase.deleteLesson(lessonId);
        return ResponseEntity.noContent().build();
    }

    private void ensureCanManageLesson(Long lessonId, Long userId, String role) {
        LessonOccurrence lesson = getScheduleUseCase.getLesson(lessonId);
        accessPolicy.ensureCanManage(userId, Role.from(role), lesson.teacherId());
    }
}
