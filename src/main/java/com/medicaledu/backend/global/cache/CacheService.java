package com.medicaledu.backend.global.cache;

import java.util.Optional;

/**
 * Key/value cache whose keys are grouped by prefix (the part before the last {@code '_'}) so a
 * write can drop every cached read of one kind at once.
 */
public interface CacheService {

    <T> Optional<T> get(String key, Class<T> type);

    void set(String key, Object value, CacheEntryOptions options);

    void remove(String key);

    /**
     * @return number of entries removed
     */
    int removeByPrefix(String prefix);

    void clear();

    long size();
}
