package com.medicaledu.backend.global.pipeline;

/**
 * Request that changes state. Commands run inside a retried transaction and invalidate the
 * cache prefixes declared with {@link com.medicaledu.backend.global.cache.CacheInvalidation}.
 */
public interface Command<R> extends Request<R> {
}
