package com.medicaledu.backend.global.pipeline;

/**
 * Marker for everything sent through the {@link Mediator}.
 *
 * @param <R> response type produced by the handler
 */
public interface Request<R> {
}
