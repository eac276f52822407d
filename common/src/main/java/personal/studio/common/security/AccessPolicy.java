package personal.studio.common.security;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

/**
 * 역할/권한 검사
 * 문자열 비교 대신 Role -> Capability 조회로 판단한다
 */
@Slf4j
@Component
public class AccessPolicy {

    /**
     * 특정 강사의 일정을 변경할 수 있는지 검증
     * ADMIN은 모든 강사, TEACHER는 본인 일정만 허용
     *
     * @param userId    요청 사용자 ID
     * @param role      요청 사용자 역할
     * @param teacherId 대상 일정의 강사 ID
     */
    public void ensureCanManage(Long userId, Role role, Long teacherId) {
        if (role.can(Capability.MANAGE_ANY_SCHEDULE)) {
            return;
        }
        if (role.can(Capability.MANAGE_OWN_SCHEDULE) && userId != null && userId.equals(teacherId)) {
            return;
        }
        log.warn("Schedule management denied: userId={}, role={}, teacherId={}", userId, role, teacherId);
        throw new BusinessException(ErrorCode.FORBIDDEN,
                String.format("User %d (%s) cannot manage schedule of teacher %d", userId, role, teacherId));
    }

    /**
     * 학원 전체 일정 관리 (일괄 생성 등) 는 ADMIN 만 허용
     */
    public void ensureCanManageAny(Long userId, Role role) {
        if (!role.can(Capability.MANAGE_ANY_SCHEDULE)) {
            log.warn("Studio-wide management denied: userId={}, role={}", userId, role);
            throw new BusinessException(ErrorCode.FORBIDDEN,
                    String.format("User %d (%s) cannot manage studio-wide schedules", userId, role));
        }
    }

    /**
     * 출석 처리 권한 검증
     */
    public void ensureCanMarkAttendance(Long userId, Role role, Long teacherId) {
        if (role.can(Capability.MANAGE_ANY_SCHEDULE)) {
            return;
        }
        if (role.can(Capability.MARK_ATTENDANCE) && userId != null && userId.equals(teacherId)) {
            return;
        }
        log.warn("Attendance marking denied: userId={}, role={}, teacherId={}", userId, role, teacherId);
        throw new BusinessException(ErrorCode.FORBIDDEN,
                String.format("User %d (%s) cannot mark attendance for teacher %d", userId, role, teacherId));
    }

    /**
     * 일정 조회 권한 검증
     */
    public void ensureCanView(Role role) {
        if (!role.can(Capability.VIEW_SCHEDULE)) {
            throw new BusinessException(ErrorCode.FORBIDDEN, "Role cannot view schedule: " + role);
        }
    }
}
