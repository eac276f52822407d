package personal.studio.schedule.scheduling.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;
import personal.studio.common.security.AccessPolicy;
import personal.studio.common.security.Capability;
import personal.studio.common.security.Role;
import personal.studio.schedule.scheduling.adapter.in.web.dto.CreatePatternRequest;
import personal.studio.schedule.scheduling.adapter.in.web.dto.GenerateLessonsRequest;
import personal.studio.schedule.scheduling.adapter.in.web.dto.GenerationResponse;
import personal.studio.schedule.scheduling.adapter.in.web.dto.PatternCreateResponse;
import personal.studio.schedule.scheduling.adapter.in.web.dto.PatternDeleteResponse;
import personal.studio.schedule.scheduling.adapter.in.web.dto.PatternResponse;
import personal.studio.schedule.scheduling.adapter.in.web.dto.PatternUpdateResponse;
import personal.studio.schedule.scheduling.adapter.in.web.dto.UpdatePatternRequest;
import personal.studio.schedule.scheduling.application.port.in.CreatePatternUseCase;
import personal.studio.schedule.scheduling.application.port.in.DeletePatternUseCase;
import personal.studio.schedule.scheduling.application.port.in.GenerateLessonsUseCase;
import personal.studio.schedule.scheduling.application.port.in.GetPatternUseCase;
import personal.studio.schedule.scheduling.application.port.in.UpdatePatternUseCase;
import personal.studio.schedule.scheduling.domain.model.PatternDetails;

import java.util.List;

/**
 * Recurring Pattern API Controller
 * 반복 패턴 등록/조회/변경/삭제 및 수업 생성 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/recurring-patterns")
@RequiredArgsConstructor
public class RecurringPatternController {

    private final CreatePatternUseCase createPatternUseCase;
    private final UpdatePatternUseCase updatePatternUseCase;
    private final DeletePatternUseCase deletePatternUseCase;
    private final GetPatternUseCase getPatternUseCase;
    private final GenerateLessonsUseCase generateLessonsUseCase;
    private final AccessPolicy accessPolicy;

    /**
     * 반복 패턴 등록 (기본 범위까지 수업 생성)
     * POST /api/v1/recurring-patterns
     */
    @PostMapping
    public ResponseEntity<PatternCreateResponse> createPattern(
            @Valid @RequestBody CreatePatternRequest request,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        log.info("Create pattern: userId={}, studioId={}, teacherId={}", userId, request.studioId(), request.teacherId());
        accessPolicy.ensureCanManage(userId, Role.from(role), request.teacherId());

        PatternCreateResponse response = PatternCreateResponse.from(
                createPatternUseCase.createPattern(request.toCommand()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * GET /api/v1/recurring-patterns/{patternId}
     */
    @GetMapping("/{patternId}")
    public ResponseEntity<PatternResponse> getPattern(
            @PathVariable Long patternId,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        PatternDetails details = getPatternUseCase.getPattern(patternId);
        accessPolicy.ensureCanManage(userId, Role.from(role), details.pattern().teacherId());
        return ResponseEntity.ok(PatternResponse.from(details));
    }

    /**
     * 패턴 목록
     * ADMIN 은 studioId 또는 teacherId 로 조회, TEACHER 는 본인 패턴만 조회
     * GET /api/v1/recurring-patterns?studioId=&teacherId=&activeOnly=
     */
    @GetMapping
    public ResponseEntity<List<PatternResponse>> getPatterns(
            @RequestParam(required = false) Long studioId,
            @RequestParam(required = false) Long teacherId,
            @RequestParam(defaultValue = "false") boolean activeOnly,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        Role userRole = Role.from(role);
        List<PatternDetails> patterns;
        if (userRole.can(Capability.MANAGE_ANY_SCHEDULE)) {
            if (teacherId != null) {
                patterns = getPatternUseCase.getPatternsByTeacher(teacherId, activeOnly);
            } else if (studioId != null) {
                patterns = getPatternUseCase.getPatternsByStudio(studioId, activeOnly);
            } else {
                throw new BusinessException(ErrorCode.INVALID_INPUT, "studioId or teacherId is required");
            }
        } else {
            Long targetTeacherId = teacherId != null ? teacherId : userId;
            accessPolicy.ensureCanManage(userId, userRole, targetTeacherId);
            patterns = getPatternUseCase.getPatternsByTeacher(targetTeacherId, activeOnly);
        }

        return ResponseEntity.ok(patterns.stream().map(PatternResponse::from).toList());
    }

    /**
     * 패턴 변경
     * 충돌이 있으면 409, force=true 면 설정된 정책대로 진행
     * PATCH /api/v1/recurring-patterns/{patternId}?force=
     */
    @PatchMapping("/{patternId}")
    public ResponseEntity<PatternUpdateResponse> updatePattern(
            @PathVariable Long patternId,
            @RequestParam(defaultValue = "false") boolean force,
            @Valid @RequestBody UpdatePatternRequest request,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        log.info("Update pattern: userId={}, patternId={}, force={}", userId, patternId, force);
        ensureCanManagePattern(patternId, userId, role);

        PatternUpdateResponse response = PatternUpdateResponse.from(
                updatePatternUseCase.updatePattern(request.toCommand(patternId, force)));
        return ResponseEntity.ok(response);
    }

    /**
     * POST /api/v1/recurring-patterns/{patternId}/deactivate
     */
    @PostMapping("/{patternId}/deactivate")
    public ResponseEntity<PatternUpdateResponse> deactivatePattern(
            @PathVariable Long patternId,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        log.info("Deactivate pattern: userId={}, patternId={}", userId, patternId);
        ensureCanManagePattern(patternId, userId, role);
        return ResponseEntity.ok(PatternUpdateResponse.from(updatePatternUseCase.deactivatePattern(patternId)));
    }

    /**
     * 패턴 삭제 (생성된 수업 포함)
     * DELETE /api/v1/recurring-patterns/{patternId}
     */
    @DeleteMapping("/{patternId}")
    public ResponseEntity<PatternDeleteResponse> deletePattern(
            @PathVariable Long patternId,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        log.info("Delete pattern: userId={}, patternId={}", userId, patternId);
        ensureCanManagePattern(patternId, userId, role);

        int deletedLessons = deletePatternUseCase.deletePattern(patternId);
        return ResponseEntity.ok(new PatternDeleteResponse(patternId, deletedLessons));
    }

    /**
     * horizonEnd 까지 수업 생성
     * POST /api/v1/recurring-patterns/{patternId}/generate
     */
    @PostMapping("/{patternId}/generate")
    public ResponseEntity<GenerationResponse> generateLessons(
            @PathVariable Long patternId,
            @Valid @RequestBody GenerateLessonsRequest request,
            @RequestHeader("X-User-Id") Long userId,
            @RequestHeader("X-User-Role") String role
    ) {
        log.info("Generate lessons: userId={}, patternId={}, horizonEnd={}", userId, patternId, request.horizonEnd());
        ensureCanManagePattern(patternId, userId, role);

        return ResponseEntity.ok(GenerationResponse.from(
                generateLessonsUseCase.generateLessons(patternId, request.horizonEnd())));
    }

    private void ensureCanManagePattern(Long patternId, Long userId, String role) {
        PatternDetails details = getPatternUseCase.getPattern(patternId);
        accessPolicy.ensureCanManage(userId, Role.from(role), details.pattern().teacherId());
    }
}
