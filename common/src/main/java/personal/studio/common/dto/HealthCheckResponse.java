package personal.studio.common.dto;

import personal.studio.common.health.ComponentStatus;

import java.time.Instant;

/**
 * Health Check 응답 데이터
 *
 * @param database  레슨 저장소 상태
 * @param redis     일정 캐시 / 스케줄러 락 저장소 상태
 * @param checkedAt 점검 시각
 */
public record HealthCheckResponse(
        ComponentStatus database,
        ComponentStatus redis,
        Instant checkedAt
) {
    public boolean isHealthy() {
        return database.isUp() && redis.isUp();
    }
}
