package personal.studio.schedule.adapter.in.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.studio.common.dto.ApiResponse;
import personal.studio.common.dto.HealthCheckResponse;
import personal.studio.common.health.HealthCheckService;

/**
 * 일정 서비스 Health Check API
 * 구성 요소 하나라도 DOWN 이면 result=error 로 응답한다 (HTTP 상태는 200 유지)
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class HealthCheckController {

    private final HealthCheckService healthCheckService;

    @GetMapping("/health")
    public ResponseEntity<ApiResponse<HealthCheckResponse>> healthCheck() {
        HealthCheckResponse report = healthCheckService.check();
        if (!report.isHealthy()) {
            log.warn("Schedule service degraded: database={}, redis={}", report.database(), report.redis());
        }
        return ResponseEntity.ok(ApiResponse.from(report.isHealthy(),
                "Schedule service is healthy", "Some components are unhealthy", report));
    }
}
