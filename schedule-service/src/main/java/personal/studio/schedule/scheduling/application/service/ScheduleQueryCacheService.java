package personal.studio.schedule.scheduling.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import personal.studio.schedule.scheduling.application.port.out.LessonOccurrenceRepository;
import personal.studio.schedule.scheduling.domain.model.LessonOccurrence;
import personal.studio.schedule.scheduling.domain.model.StudioSchedule;

import java.time.LocalDate;
import java.util.List;

/**
 * Schedule Query Cache Service
 * 프록시 기반 캐시가 동작하도록 별도 컴포넌트로 분리
 *
 * - 조회: 학원 + 기간 단위로 캐싱
 * - 무효화: 수업/패턴이 바뀌면 학원 시간표 캐시 전체 삭제
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleQueryCacheService {

    public static final String STUDIO_SCHEDULE_CACHE = "studioSchedule";

    private final LessonOccurrenceRepository lessonRepository;

    @Cacheable(value = STUDIO_SCHEDULE_CACHE, key = "#studioId + ':' + #from + ':' + #to")
    public StudioSchedule findStudioSchedule(Long studioId, LocalDate from, LocalDate to) {
        long startTime = System.currentTimeMillis();
        List<LessonOccurrence> lessons = lessonRepository.findByStudio(studioId, from, to);
        log.info("Cache MISS - Studio schedule loaded: studioId={}, from={}, to={}, lessons={}, queryTime={}ms",
                studioId, from, to, lessons.size(), System.currentTimeMillis() - startTime);
        return new StudioSchedule(studioId, from, to, lessons);
    }

    /**
     * 기간이 키에 들어가므로 어떤 키가 영향을 받는지 알 수 없어 전체 삭제한다
     */
    @CacheEvict(value = STUDIO_SCHEDULE_CACHE, allEntries = true)
    public void evictStudioSchedules() {
        log.debug("Evicting all studio schedule cache entries");
    }
}
