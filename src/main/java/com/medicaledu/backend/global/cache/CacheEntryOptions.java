package com.medicaledu.backend.global.cache;

import java.time.Duration;

/**
 * Expiration policy of a single cache entry. Either bound may be {@code null}; when both are set
 * the entry expires at whichever comes first.
 *
 * @param absoluteExpirationRelativeToNow lifetime measured from the write
 * @param slidingExpiration idle time after which the entry expires, reset on every read
 */
public record CacheEntryOptions(Duration absoluteExpirationRelativeToNow, Duration slidingExpiration) {

    public CacheEntryOptions {
        requirePositive(absoluteExpirationRelativeToNow, "absoluteExpirationRelativeToNow");
        requirePositive(slidingExpiration, "slidingExpiration");
    }

    public static CacheEntryOptions absolute(Duration ttl) {
        return new CacheEntryOptions(ttl, null);
    }

    public static CacheEntryOptions sliding(Duration idle) {
        return new CacheEntryOptions(null, idle);
    }

    private static void requirePositive(Duration duration, String name) {
        if (duration != null && (duration.isZero() || duration.isNegative())) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
