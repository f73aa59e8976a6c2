package com.medicaledu.backend.global.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.cache.CacheProperties;
import com.medicaledu.backend.global.cache.MemoryCacheService;
import com.medicaledu.backend.global.common.result.Result;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CachingBehaviorTest {

    record FindCourses(String category, int page) implements CacheableQuery<Result<String>> {

        @Override
        public String cachePrefix() {
            return CachePrefixes.GET_ALL_COURSES;
        }

        @Override
        public Duration cacheDuration() {
            return Duration.ofMinutes(5);
        }
    }

    record FindCourse(UUID id) implements CacheableQuery<Result<String>> {

        @Override
        public String cachePrefix() {
            return CachePrefixes.GET_COURSE_BY_ID;
        }

        @Override
        public Duration cacheDuration() {
            return Duration.ofMinutes(10);
        }

        @Override
        public String cacheKey() {
            return CachePrefixes.key(CachePrefixes.GET_COURSE_BY_ID, id);
        }
    }

    private final AtomicLong nanos = new AtomicLong();
    private final AtomicInteger handlerCalls = new AtomicInteger();
    private MemoryCacheService cacheService;
    private CachingBehavior behavior;

    @BeforeEach
    void setUp() {
        cacheService = new MemoryCacheService(100, nanos::get);
        behavior = new CachingBehavior(cacheService, new CacheProperties(), new ObjectMapper());
    }

    @Test
    @DisplayName("a second identical query is served from the cache")
    void cachesSuccessfulResponses() {
        FindCourses query = new FindCourses("CARDIOLOGY", 0);

        Result<String> first = behavior.handle(query, () -> handle("courses"));
        Result<String> second = behavior.handle(new FindCourses("CARDIOLOGY", 0), () -> handle("fresh"));

        assertThat(second).isSameAs(first);
        assertThat(handlerCalls).hasValue(1);
    }

    @Test
    void differentParametersUseDifferentKeys() {
        FindCourses first = new FindCourses("CARDIOLOGY", 0);
        FindCourses second = new FindCourses("CARDIOLOGY", 1);

        assertThat(behavior.cacheKey(first))
                .startsWith(CachePrefixes.GET_ALL_COURSES + "_")
                .isNotEqualTo(behavior.cacheKey(second))
                .isEqualTo(behavior.cacheKey(new FindCourses("CARDIOLOGY", 0)));
    }

    @Test
    @DisplayName("failed results are never cached")
    void skipsFailures() {
        FindCourse query = new FindCourse(UUID.randomUUID());

        behavior.handle(query, () -> {
            handlerCalls.incrementAndGet();
            return Result.notFound("COURSE_NOT_FOUND");
        });
        Result<String> retried = behavior.handle(query, () -> handle("found"));

        assertThat(retried.getValue()).isEqualTo("found");
        assertThat(handlerCalls).hasValue(2);
    }

    @Test
    @DisplayName("an explicit key lets commands evict a single query by prefix")
    void usesExplicitKey() {
        UUID id = UUID.randomUUID();
        behavior.handle(new FindCourse(id), () -> handle("course"));

        assertThat(cacheService.get("GetCourseById_" + id, Object.class)).isPresent();

        cacheService.removeByPrefix(CachePrefixes.GET_COURSE_BY_ID);
        behavior.handle(new FindCourse(id), () -> handle("course"));
        assertThat(handlerCalls).hasValue(2);
    }

    @Test
    void expiresAfterQueryDuration() {
        FindCourse query = new FindCourse(UUID.randomUUID());
        behavior.handle(query, () -> handle("v1"));

        nanos.addAndGet(Duration.ofMinutes(11).toNanos());
        Result<String> refreshed = behavior.handle(query, () -> handle("v2"));

        assertThat(refreshed.getValue()).isEqualTo("v2");
    }

    @Test
    void commandsPassThrough() {
        record Touch() implements Command<Result<String>> {
        }

        behavior.handle(new Touch(), () -> handle("a"));
        behavior.handle(new Touch(), () -> handle("b"));

        assertThat(handlerCalls).hasValue(2);
        assertThat(cacheService.size()).isZero();
    }

    private Result<String> handle(String value) {
        handlerCalls.incrementAndGet();
        return Result.success(value);
    }
}
