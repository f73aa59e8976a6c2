package com.medicaledu.backend.global.pipeline;

import java.time.Duration;

/**
 * Read whose successful response may be served from the cache.
 */
public interface CacheableQuery<R> extends Request<R> {

    String cachePrefix();

    Duration cacheDuration();

    /**
     * Explicit key; {@code null} means the key is derived from the request contents.
     */
    default String cacheKey() {
        return null;
    }
}
