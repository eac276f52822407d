package personal.studio.schedule.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;
import personal.studio.common.dto.HealthCheckResponse;
import personal.studio.common.health.ComponentStatus;
import personal.studio.common.health.HealthCheckService;

import java.time.Instant;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthCheckController.class)
@DisplayName("일정 서비스 Health Check API 테스트")
class HealthCheckControllerTest {

    private static final Instant CHECKED_AT = Instant.parse("2024-01-01T09:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HealthCheckService healthCheckService;

    @Test
    @DisplayName("저장소와 캐시가 모두 UP 이면 success 를 반환한다")
    void healthCheckReturnsSuccess() throws Exception {
        // given
        given(healthCheckService.check())
                .willReturn(new HealthCheckResponse(ComponentStatus.UP, ComponentStatus.UP, CHECKED_AT));

        // when & then
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("success"))
                .andExpect(jsonPath("$.data.database").value("UP"))
                .andExpect(jsonPath("$.data.redis").value("UP"))
                .andExpect(jsonPath("$.data.checkedAt").exists());
    }

    @Test
    @DisplayName("Redis 가 내려가면 200 과 함께 error 결과를 반환한다")
    void healthCheckReportsDegradedComponent() throws Exception {
        // given
        given(healthCheckService.check())
                .willReturn(new HealthCheckResponse(ComponentStatus.UP, ComponentStatus.DOWN, CHECKED_AT));

        // when & then
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("error"))
                .andExpect(jsonPath("$.data.redis").value("DOWN"));
    }
}
