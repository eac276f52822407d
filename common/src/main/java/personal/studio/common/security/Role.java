package personal.studio.common.security;

import personal.studio.common.exception.BusinessException;
import personal.studio.common.exception.ErrorCode;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * 사용자 역할
 * API Gateway가 JWT를 검증한 뒤 X-User-Role 헤더로 전달하는 값과 매핑된다
 */
public enum Role {
    ADMIN(EnumSet.allOf(Capability.class)),
    TEACHER(EnumSet.of(Capability.MANAGE_OWN_SCHEDULE, Capability.MARK_ATTENDANCE, Capability.VIEW_SCHEDULE)),
    STUDENT(EnumSet.of(Capability.VIEW_SCHEDULE));

    private final Set<Capability> capabilities;

    Role(Set<Capability> capabilities) {
        this.capabilities = capabilities;
    }

    public boolean can(Capability capability) {
        return capabilities.contains(capability);
    }

    /**
     * 헤더 값으로부터 역할 변환 (대소문자 무시)
     *
     * @throws BusinessException 알 수 없는 역할일 때 (403 Forbidden)
     */
    public static Role from(String value) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.FORBIDDEN, "Role header is missing");
        }
        try {
            return Role.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.FORBIDDEN, "Unknown role: " + value, e);
        }
    }
}
