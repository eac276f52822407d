package personal.studio.schedule.scheduling.adapter.in.scheduler;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import personal.studio.schedule.scheduling.application.port.in.GenerateLessonsUseCase;
import personal.studio.schedule.scheduling.application.port.out.SchedulerLockPort;
import personal.studio.schedule.scheduling.domain.model.BulkGenerationSummary;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("LessonGenerationScheduler 단위 테스트")
class LessonGenerationSchedulerTest {

    @Mock
    private GenerateLessonsUseCase generateLessonsUseCase;
    @Mock
    private SchedulerLockPort schedulerLockPort;

    private SimpleMeterRegistry meterRegistry;
    private LessonGenerationScheduler scheduler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        scheduler = new LessonGenerationScheduler(generateLessonsUseCase, schedulerLockPort, meterRegistry);
        given(schedulerLockPort.getStrategyName()).willReturn("redis");
    }

    @Test
    @DisplayName("학원별로 락을 잡고 생성한 뒤 지표를 남기고 락을 해제한다")
    void generateUpcomingLessons_recordsMetrics() {
        // given
        given(generateLessonsUseCase.findStudiosToGenerate()).willReturn(List.of(1L));
        given(schedulerLockPort.tryAcquire(LessonGenerationScheduler.JOB_NAME, 1L)).willReturn(true);
        given(generateLessonsUseCase.topUpStudio(1L)).willReturn(new BulkGenerationSummary(2, 5, 1, 0));

        // when
        scheduler.generateUpcomingLessons();

        // then
        assertThat(meterRegistry.get("schedule.generation.lessons.created").tag("studio_id", "1")
                .counter().count()).isEqualTo(5.0);
        assertThat(meterRegistry.get("schedule.generation.lessons.skipped").tag("studio_id", "1")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("schedule.generation.duration").timer().count()).isEqualTo(1);
        verify(schedulerLockPort).release(LessonGenerationScheduler.JOB_NAME, 1L);
    }

    @Test
    @DisplayName("다른 인스턴스가 락을 잡은 학원은 건너뛴다")
    void generateUpcomingLessons_lockHeld() {
        // given
        given(generateLessonsUseCase.findStudiosToGenerate()).willReturn(List.of(1L, 2L));
        given(schedulerLockPort.tryAcquire(LessonGenerationScheduler.JOB_NAME, 1L)).willReturn(false);
        given(schedulerLockPort.tryAcquire(LessonGenerationScheduler.JOB_NAME, 2L)).willReturn(true);
        given(generateLessonsUseCase.topUpStudio(2L)).willReturn(BulkGenerationSummary.empty());

        // when
        scheduler.generateUpcomingLessons();

        // then
        verify(generateLessonsUseCase, never()).topUpStudio(1L);
        verify(schedulerLockPort, never()).release(LessonGenerationScheduler.JOB_NAME, 1L);
        assertThat(meterRegistry.get("schedule.generation.lock.skipped").tag("studio_id", "1")
                .counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("한 학원이 실패해도 다음 학원은 계속 처리하고 락은 해제된다")
    void generateUpcomingLessons_failureIsolated() {
        // given
        given(generateLessonsUseCase.findStudiosToGenerate()).willReturn(List.of(1L, 2L));
        given(schedulerLockPort.tryAcquire(LessonGenerationScheduler.JOB_NAME, 1L)).willReturn(true);
        given(schedulerLockPort.tryAcquire(LessonGenerationScheduler.JOB_NAME, 2L)).willReturn(true);
        given(generateLessonsUseCase.topUpStudio(1L)).willThrow(new IllegalStateException("db down"));
        given(generateLessonsUseCase.topUpStudio(2L)).willReturn(new BulkGenerationSummary(1, 2, 0, 0));

        // when
        scheduler.generateUpcomingLessons();

        // then
        verify(schedulerLockPort).release(LessonGenerationScheduler.JOB_NAME, 1L);
        verify(schedulerLockPort).release(LessonGenerationScheduler.JOB_NAME, 2L);
        assertThat(meterRegistry.get("schedule.generation.errors").tag("studio_id", "1")
                .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("schedule.generation.lessons.created").tag("studio_id", "2")
                .counter().count()).isEqualTo(2.0);
    }
}
