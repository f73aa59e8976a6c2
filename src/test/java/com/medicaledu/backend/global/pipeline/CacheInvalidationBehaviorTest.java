package com.medicaledu.backend.global.pipeline;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

import com.medicaledu.backend.global.cache.CacheEntryOptions;
import com.medicaledu.backend.global.cache.CacheInvalidation;
import com.medicaledu.backend.global.cache.CachePrefixes;
import com.medicaledu.backend.global.cache.CacheProperties;
import com.medicaledu.backend.global.cache.MemoryCacheService;
import com.medicaledu.backend.global.common.result.Result;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.env.Environment;
import org.springframework.core.env.Profiles;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

@ExtendWith(MockitoExtension.class)
class CacheInvalidationBehaviorTest {

    @CacheInvalidation(prefixes = {CachePrefixes.GET_BOOKINGS, CachePrefixes.GET_BOOKINGS_BY_USER})
    @CacheInvalidation(prefixes = CachePrefixes.GET_AVAILABILITY_SLOTS)
    record BookSlot() implements Command<Result<String>> {
    }

    record Undeclared() implements Command<Result<String>> {
    }

    @Mock
    private Environment environment;

    private final CacheEntryOptions options = CacheEntryOptions.absolute(Duration.ofMinutes(5));
    private MemoryCacheService cacheService;
    private CacheProperties cacheProperties;
    private CacheInvalidationBehavior behavior;

    @BeforeEach
    void setUp() {
        cacheService = new MemoryCacheService(100, new AtomicLong()::get);
        cacheProperties = new CacheProperties();
        lenient().when(environment.acceptsProfiles(any(Profiles.class))).thenReturn(false);
        behavior = new CacheInvalidationBehavior(cacheService, cacheProperties, environment);

        cacheService.set("GetBookings_1", "b", options);
        cacheService.set("GetBookingsByUser_1", "u", options);
        cacheService.set("GetAvailabilitySlots_1", "s", options);
        cacheService.set("GetAllCourses_1", "c", options);
    }

    @Test
    @DisplayName("every prefix of every repeated annotation is evicted after success")
    void evictsDeclaredPrefixes() {
        behavior.handle(new BookSlot(), () -> Result.success("booked"));

        assertThat(cacheService.get("GetBookings_1", String.class)).isEmpty();
        assertThat(cacheService.get("GetBookingsByUser_1", String.class)).isEmpty();
        assertThat(cacheService.get("GetAvailabilitySlots_1", String.class)).isEmpty();
        assertThat(cacheService.get("GetAllCourses_1", String.class)).contains("c");
    }

    @Test
    void failedCommandLeavesCacheAlone() {
        behavior.handle(new BookSlot(), () -> Result.conflict("SLOT_FULL"));

        assertThat(cacheService.size()).isEqualTo(4);
    }

    @Test
    @DisplayName("an undeclared command clears the whole cache")
    void undeclaredCommandClearsEverything() {
        behavior.handle(new Undeclared(), () -> Result.success("done"));

        assertThat(cacheService.size()).isZero();
    }

    @Test
    @DisplayName("an undeclared command fails fast when explicit attributes are required")
    void undeclaredCommandRejectedWhenRequired() {
        cacheProperties.getInvalidation().setRequireExplicitAttributes(true);

        assertThatThrownBy(() -> behavior.handle(new Undeclared(), () -> Result.success("done")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Undeclared");
        assertThat(cacheService.size()).isEqualTo(4);
    }

    @Test
    void undeclaredCommandRejectedInDevelopmentProfile() {
        lenient().when(environment.acceptsProfiles(any(Profiles.class))).thenReturn(true);

        assertThatThrownBy(() -> behavior.handle(new Undeclared(), () -> Result.success("done")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("inside a transaction eviction waits for the commit")
    void defersUntilCommit() {
        TransactionSynchronizationManager.initSynchronization();
        try {
            behavior.handle(new BookSlot(), () -> Result.success("booked"));
            assertThat(cacheService.get("GetBookings_1", String.class)).contains("b");

            for (TransactionSynchronization synchronization : TransactionSynchronizationManager.getSynchronizations()) {
                synchronization.afterCommit();
            }
            assertThat(cacheService.get("GetBookings_1", String.class)).isEmpty();
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }
    }
}
