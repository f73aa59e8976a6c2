package com.medicaledu.backend.global.cache;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.github.benmanes.caffeine.cache.Ticker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caffeine-backed {@link CacheService}. Each entry carries its own absolute and sliding bounds,
 * and a side registry maps prefixes to live keys. Evicted and expired keys leave the registry
 * synchronously so a prefix never points at a key that is gone.
 */
public class MemoryCacheService implements CacheService {

    private static final Logger log = LoggerFactory.getLogger(MemoryCacheService.class);

    private final Cache<String, CacheEntry> cache;
    private final ConcurrentMap<String, Set<String>> prefixRegistry = new ConcurrentHashMap<>();
    private final Ticker ticker;

    public MemoryCacheService(long maximumSize, Ticker ticker) {
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .ticker(ticker)
                .expireAfter(new EntryExpiry())
                .evictionListener((String key, CacheEntry entry, RemovalCause cause) -> {
                    if (key != null) {
                        unregisterKey(key);
                        log.debug("Cache entry {} evicted ({})", key, cause);
                    }
                })
                .build();
    }

    @Override
    public <T> Optional<T> get(String key, Class<T> type) {
        CacheEntry entry = cache.getIfPresent(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (!type.isInstance(entry.value())) {
            log.warn("Cache entry {} holds {} but {} was requested", key, entry.value().getClass().getName(), type.getName());
            return Optional.empty();
        }
        return Optional.of(type.cast(entry.value()));
    }

    @Override
    public void set(String key, Object value, CacheEntryOptions options) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(options, "options");

        long now = ticker.read();
        long absoluteDeadline = options.absoluteExpirationRelativeToNow() == null
                ? Long.MAX_VALUE
                : now + options.absoluteExpirationRelativeToNow().toNanos();
        long slidingNanos = options.slidingExpiration() == null ? -1L : options.slidingExpiration().toNanos();

        cache.put(key, new CacheEntry(value, absoluteDeadline, slidingNanos));
        registerKey(key);
        log.debug("Cached value for key {}", key);
    }

    @Override
    public void remove(String key) {
        cache.invalidate(key);
        unregisterKey(key);
        log.debug("Removed cache entry for key {}", key);
    }

    @Override
    public int removeByPrefix(String prefix) {
        Set<String> keys = prefixRegistry.remove(prefix);
        if (keys == null || keys.isEmpty()) {
            log.debug("No cache entries found with prefix {}", prefix);
            return 0;
        }
        cache.invalidateAll(keys);
        log.debug("Removed {} cache entries with prefix {}", keys.size(), prefix);
        return keys.size();
    }

    @Override
    public void clear() {
        prefixRegistry.clear();
        cache.invalidateAll();
        log.debug("Cleared all cache entries");
    }

    @Override
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    Set<String> keysForPrefix(String prefix) {
        Set<String> keys = prefixRegistry.get(prefix);
        return keys == null ? Set.of() : Set.copyOf(keys);
    }

    void cleanUp() {
        cache.cleanUp();
    }

    static String extractPrefix(String key) {
        int lastUnderscore = key.lastIndexOf('_');
        return lastUnderscore > 0 ? key.substring(0, lastUnderscore) : key;
    }

    private void registerKey(String key) {
        prefixRegistry.compute(extractPrefix(key), (prefix, keys) -> {
            Set<String> target = keys != null ? keys : ConcurrentHashMap.newKeySet();
            target.add(key);
            return target;
        });
    }

    private void unregisterKey(String key) {
        prefixRegistry.computeIfPresent(extractPrefix(key), (prefix, keys) -> {
            keys.remove(key);
            return keys.isEmpty() ? null : keys;
        });
    }

    private record CacheEntry(Object value, long absoluteDeadlineNanos, long slidingNanos) {

        long durationFrom(long now) {
            long untilDeadline = absoluteDeadlineNanos == Long.MAX_VALUE
                    ? Long.MAX_VALUE
                    : Math.max(0L, absoluteDeadlineNanos - now);
            return slidingNanos < 0 ? untilDeadline : Math.min(slidingNanos, untilDeadline);
        }
    }

    private static final class EntryExpiry implements Expiry<String, CacheEntry> {

        @Override
        public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
            return entry.durationFrom(currentTime);
        }

        @Override
        public long expireAfterUpdate(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.durationFrom(currentTime);
        }

        @Override
        public long expireAfterRead(String key, CacheEntry entry, long currentTime, long currentDuration) {
            return entry.slidingNanos() < 0 ? currentDuration : entry.durationFrom(currentTime);
        }
    }
}
