package personal.studio.schedule.scheduling.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.studio.common.security.AccessPolicy;
import personal.studio.common.security.Role;
import personal.studio.schedule.scheduling.adapter.in.web.dto.BulkGenerationResponse;
import personal.studio.schedule.scheduling.adapter.in.web.dto.CheckConflictRequest;
import personal.studio.schedule.scheduling.adapter.in.web.dto.ConflictCheckResponse;
import personal.studio.schedule.scheduling.adapter.in.web.dto.LessonResponse;
import personal.studio.schedule.scheduling.adapter.in.web.dto.StudioScheduleResponse;
import personal.studio.schedule.scheduling.application.port.in.CheckConflictUseCase;
import personal.studio.schedule.scheduling.application.port.in.GenerateLessonsUseCase;
import personal.studio.schedule.scheduling.application.port.in.GetScheduleUseCase;

import java.time.LocalDate;
import java.util.List;

/**
 * Schedule API Controller
 * 학원/강사/학생 시간표 조회, 사전 충돌 확인, 학원 단위 수업 생성
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class ScheduleController {

    private final GetScheduleUseCase getScheduleUseCase;
    private final GenerateLessonsUseCase generateLessonsUseCase;
    private final CheckConflictUseCase checkConflictUseCase;
    private final AccessPolicy accessPolicy;

    /**
     * GET /api/v1/studios/{studioId}/lessons?from=&to=
     */
    @GetMapping("/studios/{studioId}/lessons")
    public ResponseEntity<StudioScheduleResponse> getStudioSchedule(
            @PathVariable Long studioId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestHeader("X-User-Role") String role
    ) {
        accessPolicy.ensureCanView(Role.from(role));
        return ResponseEntity.ok(StudioScheduleResponse.from(
                getScheduleUseCase.getStudioSchedule(studioId, from, to)));
    }

    /**
     * GET /api/v1/teachers/{teacherId}/lessons?from=&to=
     */
    @GetMapping("/teachers/{teacherId}/lessons")
    public ResponseEntity<List<LessonResponse>> getTeacherSchedule(
            @PathVariable Long teacherId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestHeader("X-User-Role") String role
    ) {
        accessPolicy.ensureCanView(Role.from(role));
        return ResponseEntity.ok(LessonResponse.fromAll(getScheduleUseCase.getTeacherSchedule(teacherId, from, to)));
    }

    /**
     * GET /api/v1/students/{studentId}/lessons?from=&to=
     */
    @GetMapping("/students/{studentId}/lessons")
    public ResponseEntity<List<LessonResponse>> getStudentSchedule(
            @PathVariable Long studentId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to,
            @RequestHeader("X-User-Role") String role
    ) {
        accessPolicy.ensureCanView(Role.from(role));
        return ResponseEntity.ok(LessonResponse.fromAll(getScheduleUseCase.getStudentSchedule(studentId, from, to)));
    }

    /**
     * 저장 없이 해당 시간대의 충돌만 확인
     * POST /api/v1/studios/{studioId}/lessons/check-conflict
     */
    @PostMapping("/studios/{studioId}/lessons/check-conflict")
    public ResponseEntity<ConflictCheckResponse> checkConflict(
            @PathVariable Long studioId,
            @Valid @RequestBody CheckConflictRequest request,
            @RequestHeader("X-User-Role") String role
    ) {
        accessPolicy.ensureCanView(Role.from(role));
        return ResponseEntity.ok(ConflictCheckResponse.from(
                checkConflictUseCase.checkConflicts(request.toCommand(studioId))));
    }

    /**
     * 학원 활성 패턴의 수업을 기본 범위까지 채움
     * POST /api/v1/studios/{studioId}/lessons/generate
     */
    @PostMapping("/studios/{studioId}/lessons/generate")
    public ResponseEntity<BulkGenerationResponse> topUpStudio(
            @PathVariable Long studioId,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        log.info("Studio top-up requested: userId={}, studioId={}", userId, studioId);
        accessPolicy.ensureCanManageAny(userId, Role.from(role));
        return ResponseEntity.ok(BulkGenerationResponse.of(studioId, generateLessonsUseCase.topUpStudio(studioId)));
    }
}
