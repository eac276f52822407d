package personal.studio.schedule.scheduling.adapter.in.scheduler;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import personal.studio.schedule.scheduling.application.port.in.GenerateLessonsUseCase;
import personal.studio.schedule.scheduling.application.port.out.SchedulerLockPort;
import personal.studio.schedule.scheduling.domain.model.BulkGenerationSummary;

import java.util.List;

/**
 * Lesson Generation Scheduler
 * 매일 밤 활성 패턴의 수업을 기본 범위까지 채운다
 *
 * - 학원 단위로 SchedulerLockPort 잠금을 잡아 인스턴스 간 중복 실행 방지
 * - 학원 1곳의 실패가 나머지 학원 처리를 막지 않음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LessonGenerationScheduler {

    static final String JOB_NAME = "lesson-generation";

    private final GenerateLessonsUseCase generateLessonsUseCase;
    private final SchedulerLockPort schedulerLockPort;
    private final MeterRegistry meterRegistry;

    @Scheduled(cron = "${schedule.generation-cron:0 0 2 * * *}", zone = "${schedule.timezone:Asia/Tomsk}")
    public void generateUpcomingLessons() {
        List<Long> studioIds = generateLessonsUseCase.findStudiosToGenerate();
        log.info("Nightly lesson generation started: studios={}, lockStrategy={}",
                studioIds.size(), schedulerLockPort.getStrategyName());

        int totalCreated = 0;
        for (Long studioId : studioIds) {
            if (!schedulerLockPort.tryAcquire(JOB_NAME, studioId)) {
                Counter.builder("schedule.generation.lock.skipped")
                        .tag("studio_id", String.valueOf(studioId))
                        .description("Studios skipped because another instance holds the lock")
                        .register(meterRegistry)
                        .increment();
                log.debug("Skipping studio (another instance is generating): studioId={}", studioId);
                continue;
            }

            try {
                Timer.Sample sample = Timer.start(meterRegistry);
                BulkGenerationSummary summary = generateLessonsUseCase.topUpStudio(studioId);
                sample.stop(Timer.builder("schedule.generation.duration")
                        .tag("studio_id", String.valueOf(studioId))
                        .description("Time taken to generate lessons for a studio")
                        .register(meterRegistry));

                record(studioId, summary);
                totalCreated += summary.created();
            } catch (RuntimeException e) {
                Counter.builder("schedule.generation.errors")
                        .tag("studio_id", String.valueOf(studioId))
                        .description("Studios whose generation run failed")
                        .register(meterRegistry)
                        .increment();
                log.error("Nightly lesson generation failed: studioId={}", studioId, e);
            } finally {
                schedulerLockPort.release(JOB_NAME, studioId);
            }
        }

        log.info("Nightly lesson generation finished: studios={}, created={}", studioIds.size(), totalCreated);
    }

    private void record(Long studioId, BulkGenerationSummary summary) {
        String studio = String.valueOf(studioId);
        Counter.builder("schedule.generation.lessons.created")
                .tag("studio_id", studio)
                .description("Lessons created by the nightly generation")
                .register(meterRegistry)
                .increment(summary.created());
        Counter.builder("schedule.generation.lessons.skipped")
                .tag("studio_id", studio)
                .description("Pattern slots skipped due to conflicts")
                .register(meterRegistry)
                .increment(summary.skipped());
        Counter.builder("schedule.generation.patterns.failed")
                .tag("studio_id", studio)
                .description("Patterns whose generation failed")
                .register(meterRegistry)
                .increment(summary.failed());
    }
}
