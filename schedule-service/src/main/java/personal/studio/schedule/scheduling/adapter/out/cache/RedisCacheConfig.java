package personal.studio.schedule.scheduling.adapter.out.cache;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;
import personal.studio.schedule.scheduling.application.service.ScheduleQueryCacheService;
import personal.studio.schedule.scheduling.domain.model.StudioSchedule;

import java.time.Duration;

/**
 * Redis Cache Configuration
 *
 * - 키: 문자열, 값: JSON
 * - 학원 시간표 캐시는 StudioSchedule 타입으로 고정하여 타입 정보 없이 저장
 * - CustomCacheErrorHandler 로 캐시 장애를 로그로 남기고 DB 조회로 진행
 */
@Configuration
public class RedisCacheConfig implements CachingConfigurer {

    @Value("${spring.cache.redis.time-to-live:300000}")
    private long ttlMillis;

    @Bean
    public RedisCacheManager cacheManager(RedisConnectionFactory connectionFactory) {
        RedisCacheConfiguration defaults = RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(Duration.ofMillis(ttlMillis))
                .serializeKeysWith(RedisSerializationContext.SerializationPair
                        .fromSerializer(new StringRedisSerializer()))
                .disableCachingNullValues();

        Jackson2JsonRedisSerializer<StudioSchedule> scheduleSerializer =
                new Jackson2JsonRedisSerializer<>(cacheObjectMapper(), StudioSchedule.class);

        return RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(defaults)
                .withCacheConfiguration(ScheduleQueryCacheService.STUDIO_SCHEDULE_CACHE,
                        defaults.serializeValuesWith(
                                RedisSerializationContext.SerializationPair.fromSerializer(scheduleSerializer)))
                .build();
    }

    /**
     * Record 는 필드만 직렬화한다
     * isGenerated() 같은 메서드가 "generated" 속성으로 저장되는 것을 막는다.
     */
    static ObjectMapper cacheObjectMapper() {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.setVisibility(objectMapper.getSerializationConfig()
                .getDefaultVisibilityChecker()
                .withFieldVisibility(JsonAutoDetect.Visibility.ANY)
                .withGetterVisibility(JsonAutoDetect.Visibility.NONE)
                .withIsGetterVisibility(JsonAutoDetect.Visibility.NONE));
        return objectMapper;
    }

    @Override
    public CacheErrorHandler errorHandler() {
        return new CustomCacheErrorHandler();
    }
}
