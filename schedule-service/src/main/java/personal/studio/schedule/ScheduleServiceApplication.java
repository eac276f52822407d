package personal.studio.schedule;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Schedule Service Application
 * 반복 수업 패턴과 실제 수업 일정을 관리하는 서비스
 */
@EnableCaching     // 학원 시간표 Redis 캐시
@EnableScheduling  // 야간 수업 생성 스케줄러
@SpringBootApplication(
    scanBasePackages = {
        "personal.studio.schedule",
        "personal.studio.common"  // GlobalExceptionHandler, AccessPolicy 등
    }
)
public class ScheduleServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ScheduleServiceApplication.class, args);
    }
}
