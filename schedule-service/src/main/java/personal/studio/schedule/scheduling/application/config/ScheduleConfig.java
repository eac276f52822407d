package personal.studio.schedule.scheduling.application.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 일정 관련 Bean 설정
 * 오늘 날짜는 항상 이 Clock 으로 계산한다 (테스트에서 고정 가능)
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ScheduleProperties.class)
public class ScheduleConfig {

    @Bean
    public Clock scheduleClock(ScheduleProperties properties) {
        log.info("Schedule clock initialized: timezone={}, generationWeeks={}, maxHorizonWeeks={}, forcePolicy={}",
                properties.timezone(), properties.generationWeeks(), properties.maxHorizonWeeks(),
                properties.forcePolicy());
        return Clock.system(properties.zoneId());
    }
}
