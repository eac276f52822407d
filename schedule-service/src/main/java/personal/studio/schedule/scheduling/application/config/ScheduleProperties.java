package personal.studio.schedule.scheduling.application.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import personal.studio.schedule.scheduling.domain.model.ForcePolicy;

import java.time.LocalDate;
import java.time.ZoneId;

/**
 * 일정 생성 설정
 *
 * @param generationWeeks 기본 생성 범위 (오늘부터 N주)
 * @param maxHorizonWeeks 요청 가능한 최대 생성 범위 (오늘부터 N주)
 * @param timezone        "오늘" 을 계산하는 학원 시간대
 * @param generationCron  야간 일괄 생성 cron
 * @param forcePolicy     force=true 패턴 변경 시 충돌 수업 처리 방식
 * @param exception       개별 변경 관련 설정
 */
@ConfigurationProperties(prefix = "schedule")
public record ScheduleProperties(
        @DefaultValue("2") int generationWeeks,
        @DefaultValue("52") int maxHorizonWeeks,
        @DefaultValue("Asia/Tomsk") String timezone,
        @DefaultValue("0 0 2 * * *") String generationCron,
        @DefaultValue("SKIP_CONFLICTS") ForcePolicy forcePolicy,
        @DefaultValue ExceptionPolicy exception
) {
    /**
     * @param regenerateOnRevert 개별 변경을 되돌릴 때 즉시 재생성할지 (false 면 다음 생성 주기에 복원)
     */
    public record ExceptionPolicy(
            @DefaultValue("false") boolean regenerateOnRevert
    ) {
    }

    public ZoneId zoneId() {
        return ZoneId.of(timezone);
    }

    public LocalDate defaultHorizonEnd(LocalDate today) {
        return today.plusWeeks(generationWeeks);
    }

    public LocalDate maxHorizonEnd(LocalDate today) {
        return today.plusWeeks(maxHorizonWeeks);
    }
}
