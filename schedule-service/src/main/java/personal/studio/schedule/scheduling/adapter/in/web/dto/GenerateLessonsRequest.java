package personal.studio.schedule.scheduling.adapter.in.web.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/**
 * 수업 생성 요청 DTO
 */
public record GenerateLessonsRequest(
        @NotNull(message = "생성 종료일은 필수입니다.")
        LocalDate horizonEnd
) {
}
